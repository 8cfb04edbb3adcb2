package com.incoresoft.presenceTracker.repository;

import com.incoresoft.presenceTracker.config.FaceApiProps;
import com.incoresoft.presenceTracker.domain.shared.dto.DetectedFaceDto;
import com.incoresoft.presenceTracker.domain.shared.dto.EmotionResponse;
import com.incoresoft.presenceTracker.domain.shared.dto.FaceDetectionsResponse;
import com.incoresoft.presenceTracker.domain.shared.exception.FaceExtractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Repository;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Client of the external face-analysis service (face localization, feature extraction, emotion model).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FaceApiRepository {
    private final RestTemplate faceApi;
    private final FaceApiProps props;

    // POST /faces/detect (multipart: -F image=) + query param num_jitters
    public List<DetectedFaceDto> detectFaces(byte[] image, int numJitters) {
        String url = UriComponentsBuilder
                .fromHttpUrl(props.getBaseUrl())        // http://localhost:5001/api
                .path("/faces/detect")
                .queryParam("num_jitters", numJitters)
                .build()
                .toUriString();

        try {
            ResponseEntity<FaceDetectionsResponse> resp =
                    faceApi.exchange(url, HttpMethod.POST, imageRequest(image), FaceDetectionsResponse.class);
            FaceDetectionsResponse body = resp.getBody();
            return (body == null || body.getData() == null) ? Collections.emptyList() : body.getData();
        } catch (HttpClientErrorException.NotFound nf) {
            return Collections.emptyList();
        } catch (RestClientException ex) {
            throw new FaceExtractionException("Face detection failed: " + ex.getMessage(), ex);
        }
    }

    // POST /faces/emotion (multipart: -F image=)
    public Optional<String> classifyEmotion(byte[] faceImage) {
        String url = UriComponentsBuilder
                .fromHttpUrl(props.getBaseUrl())
                .path("/faces/emotion")
                .build()
                .toUriString();
        ResponseEntity<EmotionResponse> resp =
                faceApi.exchange(url, HttpMethod.POST, imageRequest(faceImage), EmotionResponse.class);
        return Optional.ofNullable(resp.getBody()).map(EmotionResponse::getLabel);
    }

    private static HttpEntity<MultiValueMap<String, Object>> imageRequest(byte[] image) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("image", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return "image.jpg";
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return new HttpEntity<>(body, headers);
    }
}
