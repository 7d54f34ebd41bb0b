package com.hrplatform.interfaces.api.advice;

import com.hrplatform.application.AccessContextProvider;
import com.hrplatform.config.SensitiveDataProperties;
import com.hrplatform.infrastructure.security.AccessContext;
import com.hrplatform.infrastructure.security.ResponseInterceptor;
import com.hrplatform.interfaces.api.dto.ErrorResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.AbstractJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Applies {@link ResponseInterceptor} to every JSON response body, using the access context of
 * the current request. Anonymous requests are processed with the most restrictive context.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class SensitiveDataResponseAdvice implements ResponseBodyAdvice<Object> {

    private final ResponseInterceptor responseInterceptor;
    private final AccessContextProvider accessContextProvider;
    private final SensitiveDataProperties properties;

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return properties.isEnabled() && AbstractJackson2HttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(Object body,
                                  MethodParameter returnType,
                                  MediaType selectedContentType,
                                  Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  ServerHttpRequest request,
                                  ServerHttpResponse response) {
        if (body == null || body instanceof ErrorResponse) {
            return body;
        }

        AccessContext context = accessContextProvider.findCurrentContext()
            .orElseGet(AccessContext::anonymous);
        return responseInterceptor.intercept(body, context, request.getURI().getPath());
    }
}
