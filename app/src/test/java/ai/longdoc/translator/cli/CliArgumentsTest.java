package ai.longdoc.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.longdoc.translator.codec.DocumentFormat;
import ai.longdoc.translator.config.LlmProvider;
import ai.longdoc.translator.config.LogFormat;
import ai.longdoc.translator.translate.TranslationMode;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class CliArgumentsTest {

    @Test
    void convertsEnumOptionsLeniently() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments(),
                "--format", "PO", "--provider", " Gemini ", "--log-format", "json", "--translation-mode", "dry_run");

        assertThat(arguments.documentFormat()).isEqualTo(DocumentFormat.CATALOG);
        assertThat(arguments.provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(arguments.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(arguments.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
    }

    @Test
    void leavesUnsetOptionsEmpty() {
        CliArguments arguments = CommandLine.populateCommand(new CliArguments());

        assertThat(arguments.sourceFile()).isNull();
        assertThat(arguments.maxChunkSize()).isNull();
        assertThat(arguments.noValidation()).isFalse();
        assertThat(arguments.resume()).isFalse();
    }

    @Test
    void rejectedValuesNameTheAcceptedOnes() {
        assertThatThrownBy(() -> CommandLine.populateCommand(new CliArguments(), "--provider", "openai"))
                .isInstanceOf(CommandLine.ParameterException.class)
                .hasMessageContaining("ollama or gemini");
        assertThatThrownBy(() -> CommandLine.populateCommand(new CliArguments(), "--format", "docx"))
                .isInstanceOf(CommandLine.ParameterException.class)
                .hasMessageContaining("plain, catalog or ebook");
    }
}
