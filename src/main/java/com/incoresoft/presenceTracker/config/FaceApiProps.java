package com.incoresoft.presenceTracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "face.api")
public class FaceApiProps {
  private String baseUrl;
  private String token;
  /** false = random stand-in classifier, no emotion calls to the face API */
  private boolean emotionEnabled;
}
