package com.phillippitts.talkback.exception;

/**
 * Thrown when speech synthesis for a sentence fails or yields no audio.
 */
public class SynthesisException extends TalkBackException {

    private final String sentencePreview;

    public SynthesisException(String message, String sentencePreview) {
        super(message + " (sentence: \"" + sentencePreview + "\")");
        this.sentencePreview = sentencePreview;
    }

    public SynthesisException(String message, String sentencePreview, Throwable cause) {
        super(message + " (sentence: \"" + sentencePreview + "\")", cause);
        this.sentencePreview = sentencePreview;
    }

    public String getSentencePreview() {
        return sentencePreview;
    }
}
