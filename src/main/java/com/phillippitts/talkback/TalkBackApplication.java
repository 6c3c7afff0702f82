package com.phillippitts.talkback;

import com.phillippitts.talkback.config.properties.AudioProperties;
import com.phillippitts.talkback.config.properties.ConversationProperties;
import com.phillippitts.talkback.config.properties.LanguageModelProperties;
import com.phillippitts.talkback.config.properties.PlaybackProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ConversationProperties.class,
        PlaybackProperties.class,
        LanguageModelProperties.class,
        AudioProperties.class
})
public class TalkBackApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalkBackApplication.class, args);
    }

}
