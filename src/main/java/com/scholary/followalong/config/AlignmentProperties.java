package com.scholary.followalong.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for document-to-audio alignment.
 *
 * <p>Controls the similarity threshold used for fuzzy matching, the fixed confidence assigned to
 * time-based and interpolated records, and the text threshold below which a document is treated
 * as image-only.
 */
@ConfigurationProperties(prefix = "alignment")
@Validated
public record AlignmentProperties(
    @DecimalMin("0.0") @DecimalMax("1.0") double matchThreshold,
    @DecimalMin("0.0") @DecimalMax("1.0") double syntheticConfidence,
    @DecimalMin("0.0") @DecimalMax("1.0") double interpolatedConfidence,
    @Positive int minDocumentCharacters) {

  public static AlignmentProperties defaults() {
    return new AlignmentProperties(0.7, 0.3, 0.5, 100);
  }
}
