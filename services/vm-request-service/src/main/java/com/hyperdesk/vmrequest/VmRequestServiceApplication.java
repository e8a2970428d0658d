package com.hyperdesk.vmrequest;

import com.hyperdesk.vmrequest.config.HypervisorProperties;
import com.hyperdesk.vmrequest.config.ProvisioningProperties;
import com.hyperdesk.vmrequest.config.VmRequestServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * VM request service: event-sourced request lifecycle, projections and provisioning.
 */
@SpringBootApplication
@EnableConfigurationProperties({
        VmRequestServiceProperties.class,
        ProvisioningProperties.class,
        HypervisorProperties.class
})
public class VmRequestServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(VmRequestServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(VmRequestServiceApplication.class, args);
        log.info("VM request service started");
    }
}
