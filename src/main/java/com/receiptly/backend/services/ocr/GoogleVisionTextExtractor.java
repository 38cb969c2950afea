package com.receiptly.backend.services.ocr;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Feature.Type;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.google.protobuf.ByteString;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class GoogleVisionTextExtractor implements TextExtractor {

    public static final String PROVIDER = "google-vision";

    private final OcrProperties.GoogleVision settings;

    public GoogleVisionTextExtractor(OcrProperties.GoogleVision settings) {
        this.settings = settings != null ? settings : new OcrProperties.GoogleVision();
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public TextExtractionResult extract(byte[] documentBytes) {
        if (documentBytes == null || documentBytes.length == 0) {
            return new TextExtractionResult(PROVIDER, "");
        }

        long startMs = System.currentTimeMillis();
        log.info("[GoogleVision]: Processing image bytes={} projectId='{}'", documentBytes.length, safe(settings.getProjectId()));

        try (ImageAnnotatorClient client = createClient()) {
            Image image = Image.newBuilder().setContent(ByteString.copyFrom(documentBytes)).build();
            Feature feature = Feature.newBuilder().setType(Type.DOCUMENT_TEXT_DETECTION).build();
            AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                    .addFeatures(feature)
                    .setImage(image)
                    .build();

            BatchAnnotateImagesResponse response = client.batchAnnotateImages(List.of(request));
            if (response == null || response.getResponsesCount() == 0) {
                log.info("[GoogleVision]: Empty response (0 responses)");
                return new TextExtractionResult(PROVIDER, "");
            }

            AnnotateImageResponse r = response.getResponses(0);
            if (r.hasError()) {
                throw new ExtractionException(PROVIDER, "google_vision_failed: " + r.getError().getMessage());
            }

            String text = "";
            if (r.hasFullTextAnnotation()) {
                text = r.getFullTextAnnotation().getText();
            } else if (r.getTextAnnotationsCount() > 0) {
                text = r.getTextAnnotations(0).getDescription();
            }

            long elapsedMs = System.currentTimeMillis() - startMs;
            log.info("[GoogleVision]: Extracted {} characters in {}ms", text == null ? 0 : text.length(), elapsedMs);
            return new TextExtractionResult(PROVIDER, text);
        } catch (ExtractionException e) {
            log.warn("[GoogleVision]: Text extraction failed: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.warn("[GoogleVision]: Text extraction failed: {}", e.toString());
            throw new ExtractionException(PROVIDER, "google_vision_failed: " + e.getMessage(), e);
        }
    }

    private ImageAnnotatorClient createClient() throws IOException {
        // Application default credentials unless an explicit key file exists.
        String path = settings.getCredentialsPath() == null ? "" : settings.getCredentialsPath().trim();
        if (!path.isEmpty()) {
            Path p = Path.of(path);
            if (Files.exists(p)) {
                GoogleCredentials credentials;
                try (InputStream in = Files.newInputStream(p)) {
                    credentials = GoogleCredentials.fromStream(in)
                            .createScoped(List.of("https://www.googleapis.com/auth/cloud-platform"));
                }
                ImageAnnotatorSettings clientSettings = ImageAnnotatorSettings.newBuilder()
                        .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                        .build();
                return ImageAnnotatorClient.create(clientSettings);
            }
            log.warn("[GoogleVision]: credentials-path not found: '{}' (falling back to ADC)", path);
        }

        return ImageAnnotatorClient.create();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
