package com.ewsaccount.config;

import com.ewsaccount.controller.FolderController;
import com.ewsaccount.localization.LocalizationTable;
import com.ewsaccount.localization.LocalizedFolderNames;
import com.ewsaccount.service.AccountRegistry;
import com.ewsaccount.transport.ExchangeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Account layer wiring. Active once the host application provides an {@link ExchangeService}.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnBean(ExchangeService.class)
@EnableConfigurationProperties(AccountProperties.class)
@Import(AccountRegistry.class)
public class EwsAccountAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LocalizationTable localizationTable(AccountProperties properties) {
        var names = properties.getLocalization().getNames();
        log.info("Localized folder names configured for locales: {}", names.keySet());
        return new LocalizedFolderNames(names);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @Import(FolderController.class)
    static class WebConfiguration {
    }
}
