package com.tourbooking.booking.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertiesPropertySource;
import org.springframework.core.env.PropertySourcesPropertyResolver;
import org.springframework.core.io.ClassPathResource;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplicationConfigurationTest {

    @Test
    @DisplayName("ticket signing secret has no built-in fallback and must come from TICKET_SECRET")
    void ticketSecret_requiresEnvironment() {
        // given
        YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
        yaml.setResources(new ClassPathResource("application.yml"));
        Properties properties = yaml.getObject();
        MutablePropertySources sources = new MutablePropertySources();
        sources.addFirst(new PropertiesPropertySource("application", properties));
        PropertySourcesPropertyResolver resolver = new PropertySourcesPropertyResolver(sources);

        // then
        assertThat(properties.getProperty("booking.ticket.secret")).isEqualTo("${TICKET_SECRET}");
        assertThatThrownBy(() -> resolver.getRequiredProperty("booking.ticket.secret"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TICKET_SECRET");
    }
}
