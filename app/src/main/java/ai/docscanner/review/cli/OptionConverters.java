package ai.docscanner.review.cli;

import ai.docscanner.review.config.LogFormat;
import ai.docscanner.review.rule.RuleScope;
import ai.docscanner.review.segment.SegmentationStrategy;
import java.util.function.Function;
import picocli.CommandLine;

/**
 * picocli converters for the enumerated options. A rejected value is reported together with the accepted ones.
 */
public final class OptionConverters {

    private OptionConverters() {
    }

    public static final class LogFormats implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return parse(value, LogFormat::from, "text, json");
        }
    }

    public static final class SegmentationStrategies implements CommandLine.ITypeConverter<SegmentationStrategy> {
        @Override
        public SegmentationStrategy convert(String value) {
            if (value == null || value.isBlank()) {
                throw new CommandLine.TypeConversionException("Segmentation strategy must not be blank");
            }
            return parse(value, SegmentationStrategy::from, "auto, break-iterator, regex");
        }
    }

    public static final class RuleScopes implements CommandLine.ITypeConverter<RuleScope> {
        @Override
        public RuleScope convert(String value) {
            if (value == null || value.isBlank()) {
                throw new CommandLine.TypeConversionException("Rule scope must not be blank");
            }
            return parse(value, RuleScope::from, "both, document, sentence");
        }
    }

    private static <T> T parse(String value, Function<String, T> parser, String accepted) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage() + " (expected one of: " + accepted + ")");
        }
    }
}
