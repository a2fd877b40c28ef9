package com.bookdrop.catalogagent.domain.service.extraction;

import com.bookdrop.catalogagent.config.IngestConfig;
import com.bookdrop.catalogagent.domain.model.CatalogRecord;
import com.bookdrop.catalogagent.domain.model.CatalogSnapshot;
import com.bookdrop.catalogagent.domain.model.ExtractionResult;
import com.bookdrop.catalogagent.domain.model.ExtractionStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TitleAuthorExtractorTest {

    private final CatalogSnapshot catalog = CatalogSnapshot.of(List.of(
            new CatalogRecord(1, "Dune", "Frank Herbert"),
            new CatalogRecord(2, "Foundation", "Isaac Asimov"),
            new CatalogRecord(3, "The Left Hand of Darkness", "Ursula K. Le Guin")));

    private final TitleAuthorExtractor extractor = extractor(new IngestConfig());

    private static TitleAuthorExtractor extractor(IngestConfig config) {
        return new TitleAuthorExtractor(new SeriesNoiseStripper(config), List.of(
                new ByAuthorStrategy(),
                new HyphenSplitStrategy(config),
                new WholeTitleStrategy()));
    }

    @Test
    void extract_bySeparatorTakesPrecedence() {
        CatalogSnapshot misleading = CatalogSnapshot.of(List.of(
                new CatalogRecord(5, "William Gibson", "Neuromancer")));

        ExtractionResult result = extractor.extract("Neuromancer by William Gibson", misleading);

        assertThat(result.status()).isEqualTo(ExtractionStatus.RESOLVED);
        assertThat(result.title()).isEqualTo("Neuromancer");
        assertThat(result.author()).isEqualTo("William Gibson");
        assertThat(result.isCatalogHit()).isFalse();
    }

    @Test
    void extract_bySeparatorSplitsAtLastOccurrence() {
        ExtractionResult result = extractor.extract("Stand by Me by Stephen King", catalog);

        assertThat(result.title()).isEqualTo("Stand by Me");
        assertThat(result.author()).isEqualTo("Stephen King");
    }

    @Test
    void extract_bySeparatorWinsOverHyphen() {
        ExtractionResult result = extractor.extract("Tales - Volume Two by Some Writer", catalog);

        assertThat(result.title()).isEqualTo("Tales - Volume Two");
        assertThat(result.author()).isEqualTo("Some Writer");
    }

    @Test
    void extract_authorBeforeTitleIsDetectedFromCatalog() {
        ExtractionResult result = extractor.extract("Isaac Asimov - Foundation", catalog);

        assertThat(result.status()).isEqualTo(ExtractionStatus.RESOLVED);
        assertThat(result.title()).isEqualTo("Foundation");
        assertThat(result.author()).isEqualTo("Isaac Asimov");
        assertThat(result.catalogId()).isEqualTo(2);
    }

    @Test
    void extract_titleBeforeAuthorIsDetectedFromCatalog() {
        ExtractionResult result = extractor.extract("Foundation - Asimov", catalog);

        assertThat(result.title()).isEqualTo("Foundation");
        assertThat(result.author()).isEqualTo("Isaac Asimov");
        assertThat(result.catalogId()).isEqualTo(2);
    }

    @Test
    void extract_seriesTagIsIgnoredBeforeHyphenSplit() {
        ExtractionResult result = extractor.extract("Frank Herbert - Dune (Book 1)", catalog);

        assertThat(result.catalogId()).isEqualTo(1);
        assertThat(result.title()).isEqualTo("Dune");
    }

    @Test
    void extract_authorInTitleSlotIsRecognised() {
        CatalogSnapshot withBiography = CatalogSnapshot.of(List.of(
                new CatalogRecord(4, "Frank Herbert: A Biography", "Brian Herbert"),
                new CatalogRecord(1, "Dune", "Frank Herbert")));

        ExtractionResult result = extractor.extract("Dune - Frank Herbert", withBiography);

        assertThat(result.catalogId()).isEqualTo(1);
        assertThat(result.title()).isEqualTo("Dune");
        assertThat(result.author()).isEqualTo("Frank Herbert");
    }

    @Test
    void extract_unknownHyphenatedNameDefaultsToTitleOnTheRight() {
        ExtractionResult result = extractor.extract("Kim Stanley Robinson - Red Mars", catalog);

        assertThat(result.status()).isEqualTo(ExtractionStatus.RESOLVED);
        assertThat(result.title()).isEqualTo("Red Mars");
        assertThat(result.author()).isEqualTo("Kim Stanley Robinson");
        assertThat(result.catalogId()).isEqualTo(ExtractionResult.NOT_FOUND);
    }

    @Test
    void extract_laterHyphenSplitIsUsedWhenItHitsCatalog() {
        ExtractionResult result = extractor.extract("Hainish - The Left Hand of Darkness - Le Guin", catalog);

        assertThat(result.catalogId()).isEqualTo(3);
        assertThat(result.title()).isEqualTo("The Left Hand of Darkness");
        assertThat(result.author()).isEqualTo("Ursula K. Le Guin");
    }

    @Test
    void extract_hyphenResplitIsBoundedBySetting() {
        IngestConfig config = new IngestConfig();
        config.getExtraction().setMaxHyphenSplits(1);

        ExtractionResult result = extractor(config).extract("Hainish - The Left Hand of Darkness - Le Guin", catalog);

        assertThat(result.catalogId()).isEqualTo(ExtractionResult.NOT_FOUND);
        assertThat(result.title()).isEqualTo("The Left Hand of Darkness - Le Guin");
        assertThat(result.author()).isEqualTo("Hainish");
    }

    @Test
    void extract_seriesTagRecoversAuthor() {
        ExtractionResult result = extractor.extract("Dune (Frank Herbert) z-lib.org", catalog);

        assertThat(result.status()).isEqualTo(ExtractionStatus.RESOLVED);
        assertThat(result.title()).isEqualTo("Dune");
        assertThat(result.author()).isEqualTo("Frank Herbert");
    }

    @Test
    void extract_trailingParentheticalIsRemoved() {
        ExtractionResult result = extractor.extract("Moby Dick (unabridged, 1851)", catalog);

        assertThat(result.title()).isEqualTo("Moby Dick");
        assertThat(result.author()).isEmpty();
    }

    @Test
    void extract_keepsOriginalCapitalisation() {
        ExtractionResult result = extractor.extract("the hobbit by j.r.r. tolkien", CatalogSnapshot.empty());

        assertThat(result.title()).isEqualTo("the hobbit");
        assertThat(result.author()).isEqualTo("j.r.r. tolkien");
    }

    @Test
    void extract_emptyInputIsTitleEmpty() {
        assertThat(extractor.extract("", catalog).status()).isEqualTo(ExtractionStatus.TITLE_EMPTY);
        assertThat(extractor.extract("(Book 3)", catalog).status()).isEqualTo(ExtractionStatus.TITLE_EMPTY);
        assertThat(extractor.extract("z-lib.org", catalog).status()).isEqualTo(ExtractionStatus.TITLE_EMPTY);
    }

    @Test
    void extract_keepsInnerSpacingOfUnknownTitle() {
        ExtractionResult result = extractor.extract("Red  Mars", catalog);

        assertThat(result.status()).isEqualTo(ExtractionStatus.RESOLVED);
        assertThat(result.title()).isEqualTo("Red  Mars");
        assertThat(result.author()).isEmpty();
    }
}
