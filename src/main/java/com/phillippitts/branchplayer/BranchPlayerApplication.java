package com.phillippitts.branchplayer;

import com.phillippitts.branchplayer.config.properties.FlowProperties;
import com.phillippitts.branchplayer.config.properties.SimulatedBackendProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        FlowProperties.class,
        SimulatedBackendProperties.class
})
@EnableScheduling
public class BranchPlayerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BranchPlayerApplication.class, args);
    }

}
