package com.ai.autoreply.component;

import org.springframework.stereotype.Component;

/**
 * Fixed customer-facing texts the agent sends on its own initiative.
 */
@Component
public class ResponsePhrases {

    public String handoffAcknowledgement() {
        return "Got it! I'm calling a human teammate to help you. Someone will be with you shortly. 🙌";
    }

    public String mediaAcknowledgement() {
        return "Perfect, sending it to you now.";
    }

    public String mediaNotFound() {
        return "Sorry, I don't have an image or video of that available right now.";
    }

    public String mediaDeliveryFailed() {
        return "Sorry, I had trouble sending the media. Please try again in a moment.";
    }

    public String outOfHoursDefault() {
        return "Hi! We're outside our opening hours right now. Leave your message and we'll get back to you as soon as possible! 🕐";
    }

    public String fallback() {
        return "Sorry, I couldn't come up with a reply. Could you say that again?";
    }

    public String audioPlaceholder() {
        return "[Audio received - could not transcribe]";
    }

    public String imagePlaceholder() {
        return "[Image received - could not analyze]";
    }

    public String imageWithCaption(String caption, String analysis) {
        return "[Image with caption: \"" + caption + "\"]\n\nImage analysis: " + analysis;
    }

    public String imageWithoutCaption(String analysis) {
        return "[Image received]\n\nAnalysis: " + analysis;
    }

    public String pdfReceived(String fileName) {
        return "[PDF received: " + fileName + "]";
    }

    public String documentReceived(String fileName) {
        return "[Document received: " + fileName + "]";
    }

    public String documentImageAnalysis(String fileName, String analysis) {
        return "[Document image: " + fileName + "]\n\nAnalysis: " + analysis;
    }

    public String defaultVisionPrompt() {
        return "Describe this image in detail. If there is text in it, transcribe it.";
    }

    public String captionVisionPrompt(String caption) {
        return "The user sent this image with the caption \"" + caption + "\". "
                + "Describe the image in detail and relate it to the caption. If there is text in it, transcribe it.";
    }

    public String documentVisionPrompt() {
        return "This image was sent as a document. Extract and describe all of its relevant content, transcribing any text.";
    }

    public String handoffReasonDefault() {
        return "Transfer requested";
    }

    public String handoffHistoryDefault() {
        return "No history available";
    }

    public String widgetUnavailable() {
        return "Sorry, I can't answer right now. Please try again later.";
    }
}
