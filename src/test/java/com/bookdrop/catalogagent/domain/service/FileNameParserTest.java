package com.bookdrop.catalogagent.domain.service;

import com.bookdrop.catalogagent.domain.model.BookFileName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileNameParserTest {

    private final FileNameParser parser = new FileNameParser();

    @Test
    void parse_shouldSplitBaseNameAndExtension() {
        BookFileName file = parser.parse("Isaac Asimov - Foundation.EPUB");

        assertThat(file.baseName()).isEqualTo("Isaac Asimov - Foundation");
        assertThat(file.extension()).isEqualTo("epub");
        assertThat(file.hasExtension()).isTrue();
    }

    @Test
    void parse_shouldKeepDotsInsideBaseName() {
        BookFileName file = parser.parse("J.R.R. Tolkien - The Hobbit.mobi");

        assertThat(file.baseName()).isEqualTo("J.R.R. Tolkien - The Hobbit");
        assertThat(file.extension()).isEqualTo("mobi");
    }

    @Test
    void parse_shouldDropDirectories() {
        BookFileName file = parser.parse("sci-fi/Dune.epub");

        assertThat(file.fileName()).isEqualTo("Dune.epub");
        assertThat(file.baseName()).isEqualTo("Dune");
    }

    @Test
    void parse_withoutExtension() {
        BookFileName file = parser.parse("README");

        assertThat(file.baseName()).isEqualTo("README");
        assertThat(file.hasExtension()).isFalse();
    }

    @Test
    void parse_onlyExtensionLeavesEmptyBaseName() {
        BookFileName file = parser.parse(".epub");

        assertThat(file.baseName()).isEmpty();
        assertThat(file.extension()).isEqualTo("epub");
    }
}
