package ai.longdoc.translator.cli;

import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.config.ConfigurationException;
import ai.longdoc.translator.config.LlmProvider;
import ai.longdoc.translator.config.LogFormat;
import ai.longdoc.translator.translate.TranslationMode;
import picocli.CommandLine;

/**
 * Picocli converters for the enum valued options. Rejected values are reported with the accepted spellings.
 */
final class OptionConverters {

    private OptionConverters() {
    }

    static final class DocumentFormatConverter implements CommandLine.ITypeConverter<DocumentFormat> {
        @Override
        public DocumentFormat convert(String value) {
            try {
                return DocumentFormat.from(value);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.TypeConversionException(
                        "'" + value + "' is not a document format (expected plain, catalog or ebook)");
            }
        }
    }

    static final class LlmProviderConverter implements CommandLine.ITypeConverter<LlmProvider> {
        @Override
        public LlmProvider convert(String value) {
            try {
                return LlmProvider.from(value);
            } catch (ConfigurationException ex) {
                throw new CommandLine.TypeConversionException(
                        "'" + value + "' is not a provider (expected ollama or gemini)");
            }
        }
    }

    static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            try {
                return LogFormat.from(value);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.TypeConversionException("'" + value + "' is not a log format (expected text or json)");
            }
        }
    }

    static final class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {
        @Override
        public TranslationMode convert(String value) {
            try {
                return TranslationMode.from(value);
            } catch (IllegalArgumentException ex) {
                throw new CommandLine.TypeConversionException(
                        "'" + value + "' is not a translation mode (expected production, dry-run or mock)");
            }
        }
    }
}
