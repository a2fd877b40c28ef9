package com.bookdrop.catalogagent.domain.model;

public record ConversionDecision(
        Verdict verdict,
        String targetFormat,
        String outputFileName
) {
    public enum Verdict {
        CONVERT,
        ABANDONED_PDF,
        FORMAT_IN_DB,
        NOT_APPLICABLE
    }

    public static ConversionDecision convert(String targetFormat, String outputFileName) {
        return new ConversionDecision(Verdict.CONVERT, targetFormat, outputFileName);
    }

    public static ConversionDecision of(Verdict verdict, String targetFormat) {
        return new ConversionDecision(verdict, targetFormat, "");
    }

    public static ConversionDecision notApplicable() {
        return new ConversionDecision(Verdict.NOT_APPLICABLE, "", "");
    }
}
