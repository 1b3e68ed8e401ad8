package com.phillippitts.clipcast;

import com.phillippitts.clipcast.config.properties.CaptureProperties;
import com.phillippitts.clipcast.config.properties.DebounceProperties;
import com.phillippitts.clipcast.config.properties.EncoderProperties;
import com.phillippitts.clipcast.config.properties.HotkeyProperties;
import com.phillippitts.clipcast.config.properties.RecordingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        RecordingProperties.class,
        CaptureProperties.class,
        EncoderProperties.class,
        DebounceProperties.class,
        HotkeyProperties.class
})
@EnableScheduling
public class ClipCastApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClipCastApplication.class, args);
    }

}
