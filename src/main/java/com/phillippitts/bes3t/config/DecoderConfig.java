package com.phillippitts.bes3t.config;

import com.phillippitts.bes3t.config.properties.DecoderProperties;
import com.phillippitts.bes3t.config.properties.ImportProperties;
import com.phillippitts.bes3t.service.DecoderSettings;
import com.phillippitts.bes3t.service.archive.ArchiveParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Spring-free decoder core from {@code decoder.*} properties.
 */
@Configuration
public class DecoderConfig {

    private static final Logger LOG = LogManager.getLogger(DecoderConfig.class);

    @Bean
    public DecoderSettings decoderSettings(DecoderProperties props) {
        DecoderSettings settings = props.toSettings();
        LOG.info("Decoder settings: {}", settings);
        return settings;
    }

    @Bean
    public ArchiveParser archiveParser(DecoderSettings settings, ImportProperties importProperties) {
        return new ArchiveParser(settings, importProperties.getMaxEntrySizeBytes());
    }
}
