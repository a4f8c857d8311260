package com.phillippitts.frontdesk;

import com.phillippitts.frontdesk.config.properties.AudioProperties;
import com.phillippitts.frontdesk.config.properties.BusProperties;
import com.phillippitts.frontdesk.config.properties.CarrierProperties;
import com.phillippitts.frontdesk.config.properties.DeepgramProperties;
import com.phillippitts.frontdesk.config.properties.ElevenLabsProperties;
import com.phillippitts.frontdesk.config.properties.InterruptionProperties;
import com.phillippitts.frontdesk.config.properties.KnowledgeBaseProperties;
import com.phillippitts.frontdesk.config.properties.OpenAiProperties;
import com.phillippitts.frontdesk.config.properties.PlaybackProperties;
import com.phillippitts.frontdesk.config.properties.ReplyProperties;
import com.phillippitts.frontdesk.config.properties.RoutingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioProperties.class,
        PlaybackProperties.class,
        RoutingProperties.class,
        ReplyProperties.class,
        InterruptionProperties.class,
        DeepgramProperties.class,
        ElevenLabsProperties.class,
        OpenAiProperties.class,
        KnowledgeBaseProperties.class,
        CarrierProperties.class,
        BusProperties.class
})
@EnableScheduling
public class FrontDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(FrontDeskApplication.class, args);
    }

}
