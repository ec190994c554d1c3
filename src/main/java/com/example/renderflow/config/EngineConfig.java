package com.example.renderflow.config;

import com.example.renderflow.engine.EncoderLauncher;
import com.example.renderflow.engine.PlanCompiler;
import com.example.renderflow.engine.ProcessEncoderLauncher;
import com.example.renderflow.service.AssetFetcher;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class EngineConfig {

    @Bean
    public PlanCompiler planCompiler(RenderflowProperties properties) {
        RenderflowProperties.Encoder enc = properties.getEncoder();
        return new PlanCompiler(enc.getBinary(), enc.getVideoCodec(), enc.getPreset(),
                enc.getAudioCodec(), enc.getAudioBitrate());
    }

    @Bean
    public EncoderLauncher encoderLauncher() {
        return new ProcessEncoderLauncher();
    }

    @Bean
    public AssetFetcher assetFetcher(RenderflowProperties properties) {
        Path tempDir = Path.of(properties.getStorage().getTempDir());
        RenderflowProperties.Downloader dl = properties.getDownloader();
        var fetcher = new AssetFetcher(tempDir, dl.getTimeoutSeconds(), dl.getUserAgent(), dl.getMaxRedirects());
        LoggerFactory.getLogger(EngineConfig.class)
                .info("Asset cache wired: tempDir={}, outputDir={}", tempDir.toAbsolutePath(), properties.getStorage().getOutputDir());
        return fetcher;
    }
}
