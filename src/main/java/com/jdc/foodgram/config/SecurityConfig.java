package com.jdc.foodgram.config;

import com.jdc.foodgram.jwt.JwtAuthenticationFilter;
import com.jdc.foodgram.security.CustomAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtAuthenticationFilter jwtFilter;
    private final CustomAuthenticationEntryPoint entryPoint;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()

                        // 1) 공개 리소스
                        .requestMatchers(
                                "/v3/api-docs/**",
                                "/swagger-ui/**",
                                "/swagger-ui.html",
                                "/h2-console/**",
                                "/media/**",
                                "/error"
                        ).permitAll()

                        // 2) GET 중 인증 필요 (아래 와일드카드보다 먼저 매칭돼야 한다)
                        .requestMatchers(HttpMethod.GET,
                                "/api/users/me",
                                "/api/users/subscriptions",
                                "/api/recipes/download_shopping_cart"
                        ).authenticated()

                        // 3) 회원가입, 로그인
                        .requestMatchers(HttpMethod.POST,
                                "/api/users",
                                "/api/auth/token/login"
                        ).permitAll()

                        // 4) 공개 GET
                        .requestMatchers(HttpMethod.GET,
                                "/api/recipes",
                                "/api/recipes/**",
                                "/api/tags",
                                "/api/tags/**",
                                "/api/ingredients",
                                "/api/ingredients/**",
                                "/api/users",
                                "/api/users/**",
                                "/s/**"
                        ).permitAll()

                        // 5) 나머지는 인증 필요
                        .anyRequest().authenticated()
                )
                .headers(h -> h.frameOptions(frame -> frame.sameOrigin()))
                .exceptionHandling(e -> e.authenticationEntryPoint(entryPoint))
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
