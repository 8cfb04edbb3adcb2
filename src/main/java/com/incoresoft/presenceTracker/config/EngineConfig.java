package com.incoresoft.presenceTracker.config;

import com.incoresoft.presenceTracker.domain.emotion.service.EmotionClassifier;
import com.incoresoft.presenceTracker.domain.emotion.service.RandomEmotionClassifier;
import com.incoresoft.presenceTracker.domain.emotion.service.RemoteEmotionClassifier;
import com.incoresoft.presenceTracker.domain.matching.service.EuclideanSimilarity;
import com.incoresoft.presenceTracker.domain.matching.service.SimilarityFunction;
import com.incoresoft.presenceTracker.repository.FaceApiRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class EngineConfig {

    private final PresenceProps props;

    @PostConstruct
    public void init() {
        props.validateThresholds();
        log.info("Presence engine: window={}, known>={}, unknown<{}, history capacity={}",
                props.getActivationWindow(), props.getKnownThreshold(),
                props.getUnknownThreshold(), props.getHistoryCapacity());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SimilarityFunction similarityFunction() {
        return new EuclideanSimilarity();
    }

    @Bean
    public EmotionClassifier emotionClassifier(FaceApiProps faceProps, FaceApiRepository repo) {
        if (faceProps.isEmotionEnabled()) {
            log.info("Emotion classification via face API");
            return new RemoteEmotionClassifier(repo);
        }
        log.info("Emotion model disabled, using random labels");
        return new RandomEmotionClassifier();
    }
}
