package com.supersoft.photonest.media_import_processor.service;

public interface SelectionQueuePublisher {
    void publish(Long selectionId, Long sessionId);

    class SelectionMessage {
        private Long selectionId;
        private Long sessionId;

        public SelectionMessage() {}

        public SelectionMessage(Long selectionId, Long sessionId) {
            this.selectionId = selectionId;
            this.sessionId = sessionId;
        }

        public Long getSelectionId() { return selectionId; }
        public void setSelectionId(Long selectionId) { this.selectionId = selectionId; }
        public Long getSessionId() { return sessionId; }
        public void setSessionId(Long sessionId) { this.sessionId = sessionId; }
    }
}
