package com.phillippitts.bes3t.config;

import com.phillippitts.bes3t.config.properties.DecoderProperties;
import com.phillippitts.bes3t.config.properties.ImportProperties;
import com.phillippitts.bes3t.service.DecoderSettings;
import com.phillippitts.bes3t.service.archive.ArchiveParser;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class DecoderConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class, DecoderConfig.class);

    @Test
    void buildsSettingsAndParserFromProperties() {
        runner.withPropertyValues("decoder.noisy-imag-threshold=0.3")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(DecoderSettings.class);
                    assertThat(ctx).hasSingleBean(ArchiveParser.class);
                    assertThat(ctx.getBean(DecoderSettings.class).noisyImagThreshold()).isEqualTo(0.3);
                });
    }

    @Test
    void defaultsMatchBuiltInSettings() {
        runner.run(ctx -> assertThat(ctx.getBean(DecoderSettings.class)).isEqualTo(DecoderSettings.defaults()));
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties({DecoderProperties.class, ImportProperties.class})
    static class PropertiesConfig {
    }
}
