package com.scholary.followalong.config;

import com.scholary.followalong.backend.Backend;
import com.scholary.followalong.backend.BackendProbe;
import com.scholary.followalong.backend.CpuProbe;
import com.scholary.followalong.backend.MetalProbe;
import com.scholary.followalong.backend.Platform;
import com.scholary.followalong.backend.VariantBinaryProbe;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the speech-recognition engine.
 *
 * <p>Enables the EngineProperties to be loaded from application.yml and declares the backend probes
 * in priority order: Metal, CUDA, Vulkan, CPU.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

  @Bean
  public Platform platform() {
    return Platform.current();
  }

  @Bean
  public List<BackendProbe> backendProbes(EngineProperties properties) {
    EngineProperties.VariantBinaries variants = properties.variantBinaries();
    String cuda = variants == null ? null : variants.cuda();
    String vulkan = variants == null ? null : variants.vulkan();
    return List.of(
        new MetalProbe(),
        new VariantBinaryProbe(Backend.CUDA, cuda),
        new VariantBinaryProbe(Backend.VULKAN, vulkan),
        new CpuProbe());
  }

  @Bean
  public HttpClient modelDownloadClient() {
    return HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(Duration.ofSeconds(30))
        .build();
  }
}
