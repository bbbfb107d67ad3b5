package com.signaldesk.pipeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineApplicationTest {

    @Test
    void expandsCommandLineShorthands() {
        String[] expanded = PipelineApplication.expandShorthands(
            new String[] {"--once", "--dev", "--server.port=0"}
        );

        assertThat(expanded).containsExactly(
            "--pipeline.cli.mode=once",
            "--pipeline.demo-mode=true",
            "--server.port=0"
        );
    }

    @Test
    void expandsJobShorthand() {
        assertThat(PipelineApplication.expandShorthands(new String[] {"--job=market-quotes"}))
            .containsExactly("--pipeline.cli.mode=job", "--pipeline.cli.job=market-quotes");
    }

    @Test
    void debugRaisesPipelineLogLevel() {
        assertThat(PipelineApplication.expandShorthands(new String[] {"--debug", "--once"}))
            .containsExactly("--logging.level.com.signaldesk.pipeline=DEBUG", "--pipeline.cli.mode=once");
    }
}
