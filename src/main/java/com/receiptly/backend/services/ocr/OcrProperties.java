package com.receiptly.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receiptly.ocr")
public class OcrProperties {

    /**
     * When false every OCR call fails; PDFs with a text layer are still read.
     */
    private boolean enabled = false;

    /**
     * OCR provider to register. Only "google-vision" ships.
     */
    private String provider = GoogleVisionTextExtractor.PROVIDER;

    private GoogleVision googleVision = new GoogleVision();

    private Pdf pdf = new Pdf();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public GoogleVision getGoogleVision() {
        return googleVision;
    }

    public void setGoogleVision(GoogleVision googleVision) {
        this.googleVision = googleVision;
    }

    public Pdf getPdf() {
        return pdf;
    }

    public void setPdf(Pdf pdf) {
        this.pdf = pdf;
    }

    public static class GoogleVision {

        private String projectId = "";

        /**
         * Service account key file. Empty means application default credentials.
         */
        private String credentialsPath = "";

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getCredentialsPath() {
            return credentialsPath;
        }

        public void setCredentialsPath(String credentialsPath) {
            this.credentialsPath = credentialsPath;
        }
    }

    public static class Pdf {

        /**
         * A PDF text layer at least this long is used instead of calling OCR.
         */
        private int minTextLength = 40;

        /**
         * Max number of pages read from the text layer.
         */
        private int maxPages = 3;

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }
    }
}
