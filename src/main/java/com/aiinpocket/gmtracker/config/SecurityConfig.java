package com.aiinpocket.gmtracker.config;

import com.aiinpocket.gmtracker.security.AdminApiKeyFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security 安全配置。
 * 遊戲化 API 由上游（遊戲動作處理器）呼叫，本身不做使用者登入；
 * 只有管理重置端點需要 Bearer 管理金鑰。
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, GamificationProperties props) throws Exception {
        http
                .authorizeHttpRequests(auth -> auth
                        // 管理端點：需通過 AdminApiKeyFilter
                        .requestMatchers("/api/gamification/admin/**").hasRole("ADMIN")
                        .requestMatchers("/api/gamification/**").permitAll()
                        // Actuator 只放行健康檢查端點（K8s liveness/readiness probe 用）
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .anyRequest().denyAll()
                )
                .addFilterBefore(new AdminApiKeyFilter(props), UsernamePasswordAuthenticationFilter.class)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                // REST API 不使用 CSRF 保護
                .csrf(csrf -> csrf.ignoringRequestMatchers("/api/**"))
                .httpBasic(basic -> basic.disable())
                .formLogin(form -> form.disable());

        return http.build();
    }
}
