package com.example.motion_photo_muxer.config;

import com.example.motion_photo_muxer.engine.ExternalStillConverter;
import com.example.motion_photo_muxer.engine.Interfaces.StillConverter;
import com.example.motion_photo_muxer.service.InteractivePrompter;
import com.example.motion_photo_muxer.service.metadata.CaptureMetadataCopier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.Charset;

@EnableConfigurationProperties(MuxerProperties.class)
@Configuration
public class MuxerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(MuxerConfig.class);

    @Bean
    public StillConverter stillConverter(MuxerProperties properties, CaptureMetadataCopier metadataCopier) {
        MuxerProperties.Converter converter = properties.getConverter();
        LOGGER.info("Still converter wired: command={}, timeout={}s, copyMetadata={}",
                converter.getCommand(), converter.getTimeoutSeconds(), converter.isCopyMetadata());
        return new ExternalStillConverter(converter, metadataCopier);
    }

    @Bean
    public InteractivePrompter interactivePrompter() {
        return new InteractivePrompter(
                new BufferedReader(new InputStreamReader(System.in, Charset.defaultCharset())),
                System.out,
                System.console() != null);
    }
}
