package com.bbthechange.gallery.config;

import com.bbthechange.gallery.security.AdminAllowList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AdminConfig {

    private static final Logger logger = LoggerFactory.getLogger(AdminConfig.class);

    @Bean
    public AdminAllowList adminAllowList(AdminProperties adminProperties) {
        AdminAllowList allowList = new AdminAllowList(adminProperties.getEmails());
        logger.info("Loaded admin allow-list with {} entries", allowList.size());
        return allowList;
    }
}
