package jsonc;

import static jsonc.JacksonTest.resource;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SamplePipelineTest {

    static final FormatConfig CONFIG =
            FormatConfig.defaults().toBuilder().insertFinalNewline(true).build();

    @Test
    void formatsSample() {
        var input = resource("pipeline/sample_pipeline.jsonc");

        assertThat(Jsonc.format(input, CONFIG)).isEqualTo(resource("pipeline/sample_pipeline.formatted.jsonc"));
    }

    @Test
    void formattedSampleIsStable() {
        var formatted = resource("pipeline/sample_pipeline.formatted.jsonc");

        assertThat(Jsonc.format(formatted, CONFIG)).isEqualTo(formatted);
    }
}
