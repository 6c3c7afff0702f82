package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.service.audio.AudioIo;
import com.phillippitts.talkback.service.llm.LanguageModelService;
import com.phillippitts.talkback.service.stt.SpeechToTextService;
import com.phillippitts.talkback.service.tts.SpeechSynthesisService;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider collaborators for one session. Any of them may be {@code null}; a session refuses to
 * start until all four are present.
 */
public record SessionServices(AudioIo audioIo,
                              SpeechToTextService speechToText,
                              LanguageModelService languageModel,
                              SpeechSynthesisService speechSynthesis) {

    /**
     * @return names of the collaborators that are missing, empty if complete
     */
    public List<String> missing() {
        List<String> missing = new ArrayList<>();
        if (audioIo == null) {
            missing.add("audioIo");
        }
        if (speechToText == null) {
            missing.add("speechToText");
        }
        if (languageModel == null) {
            missing.add("languageModel");
        }
        if (speechSynthesis == null) {
            missing.add("speechSynthesis");
        }
        return missing;
    }
}
