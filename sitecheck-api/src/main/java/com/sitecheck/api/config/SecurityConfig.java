package com.sitecheck.api.config;

import com.sitecheck.api.security.SharedSecretAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final SecurityProperties securityProperties;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        SharedSecretAuthenticationFilter sharedSecretFilter = new SharedSecretAuthenticationFilter(
            securityProperties.getQueueSecret(),
            securityProperties.getAdminSecret()
        );

        http
            .csrf(csrf -> csrf.disable())
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/api/health/**", "/api/health").permitAll()
                .requestMatchers("/actuator/health").permitAll()
                .requestMatchers("/error").permitAll()
                .requestMatchers(SharedSecretAuthenticationFilter.QUEUE_PATH)
                    .hasAuthority(SharedSecretAuthenticationFilter.ROLE_QUEUE)
                .requestMatchers(SharedSecretAuthenticationFilter.ADMIN_PATH + "/**")
                    .hasAuthority(SharedSecretAuthenticationFilter.ROLE_ADMIN)
                .anyRequest().denyAll()
            )
            .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .addFilterBefore(sharedSecretFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
