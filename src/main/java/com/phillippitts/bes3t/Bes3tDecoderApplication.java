package com.phillippitts.bes3t;

import com.phillippitts.bes3t.config.properties.DecoderProperties;
import com.phillippitts.bes3t.config.properties.ImportProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        DecoderProperties.class,
        ImportProperties.class
})
public class Bes3tDecoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(Bes3tDecoderApplication.class, args);
    }

}
