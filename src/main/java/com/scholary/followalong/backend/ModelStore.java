package com.scholary.followalong.backend;

import com.scholary.followalong.config.EngineProperties;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Local store of recognition model artifacts.
 *
 * <p>Models live under the configured models directory as {@code ggml-{name}.bin}. A missing model
 * is downloaded from the registry into a {@code .tmp} sibling and renamed into place only once the
 * whole body has been written, so a file under the final name is always complete.
 */
@Component
public class ModelStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelStore.class);

  private static final Pattern MODEL_NAME = Pattern.compile("[A-Za-z0-9._-]+");

  private final Path modelsDir;
  private final String registryUrl;
  private final HttpClient httpClient;
  private final Duration downloadTimeout;

  @Autowired
  public ModelStore(EngineProperties properties, HttpClient modelDownloadClient) {
    this(
        Path.of(properties.modelsPath()),
        properties.registryUrl(),
        modelDownloadClient,
        Duration.ofMinutes(properties.downloadTimeoutMinutes()));
  }

  public ModelStore(
      Path modelsDir, String registryUrl, HttpClient httpClient, Duration downloadTimeout) {
    this.modelsDir = modelsDir;
    this.registryUrl = registryUrl.endsWith("/") ? registryUrl : registryUrl + "/";
    this.httpClient = httpClient;
    this.downloadTimeout = downloadTimeout;
  }

  public Path modelPath(String name) {
    if (name == null || !MODEL_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid model name: " + name);
    }
    return modelsDir.resolve(fileName(name));
  }

  public boolean isDownloaded(String name) {
    return Files.isRegularFile(modelPath(name));
  }

  /**
   * Returns the local path of a model, downloading it first when absent.
   *
   * @throws ModelDownloadException on a network error or a non-2xx response
   */
  public synchronized Path ensureModel(String name) {
    Path target = modelPath(name);
    if (Files.isRegularFile(target)) {
      return target;
    }
    URI source = URI.create(registryUrl + fileName(name));
    LOGGER.info("Model {} not found locally, downloading from {}", name, source);
    long startTime = System.currentTimeMillis();
    download(source, target);
    LOGGER.info(
        "Model {} downloaded to {} in {}ms",
        name,
        target,
        System.currentTimeMillis() - startTime);
    return target;
  }

  private void download(URI source, Path target) {
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    HttpRequest request = HttpRequest.newBuilder(source).timeout(downloadTimeout).GET().build();
    try {
      Files.createDirectories(modelsDir);
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream body = response.body()) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
          throw new ModelDownloadException(
              String.format(
                  "Model download from %s failed with status %d", source, response.statusCode()));
        }
        Files.copy(body, temp, StandardCopyOption.REPLACE_EXISTING);
      }
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new ModelDownloadException("Model download from " + source + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ModelDownloadException("Model download interrupted", e);
    } finally {
      deleteQuietly(temp);
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete partial download {}: {}", temp, e.getMessage());
    }
  }

  private static String fileName(String name) {
    return "ggml-" + name + ".bin";
  }
}
