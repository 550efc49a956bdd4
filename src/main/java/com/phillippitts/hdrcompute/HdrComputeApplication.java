package com.phillippitts.hdrcompute;

import com.phillippitts.hdrcompute.config.properties.ComputeProperties;
import com.phillippitts.hdrcompute.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ThreadPoolProperties.class,
        ComputeProperties.class
})
@EnableScheduling
public class HdrComputeApplication {

    public static void main(String[] args) {
        SpringApplication.run(HdrComputeApplication.class, args);
    }

}
