package com.bluequee.tabconfig.infrastructure.web;

import com.bluequee.observability.CorrelationContextHolder;
import com.bluequee.security.ClinicSecurityContext;
import com.bluequee.security.SecurityContextSerializer;
import com.bluequee.security.SecurityContextSerializer.SecuritySerializationException;
import com.bluequee.security.SecurityContextValidator;
import com.bluequee.security.SecurityValidationResult;
import com.bluequee.tabconfig.domain.ViewerIdentity;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Turns the gateway's {@value SecurityContextSerializer#HEADER} header into a {@link ViewerIdentity}
 * controller argument.
 *
 * <p>Authentication happens upstream; this resolver only decodes and structurally validates the
 * forwarded context. A missing, undecodable or invalid header fails the request with
 * {@link MissingSecurityContextException}.
 */
public class SecurityContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ViewerIdentity.class.equals(parameter.getParameterType());
    }

    @Override
    public ViewerIdentity resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(SecurityContextSerializer.HEADER);
        if (header == null || header.isBlank()) {
            throw new MissingSecurityContextException("Authentication required");
        }

        ClinicSecurityContext context;
        try {
            context = SecurityContextSerializer.deserialize(header);
        } catch (SecuritySerializationException e) {
            throw new MissingSecurityContextException("Malformed security context", e);
        }
        SecurityValidationResult validation = SecurityContextValidator.validate(context);
        if (!validation.valid()) {
            throw new MissingSecurityContextException(
                    "Invalid security context: " + String.join("; ", validation.errors()));
        }

        ViewerIdentity identity = ViewerIdentity.from(context);
        CorrelationContextHolder.attachIdentity(identity.organizationId(), identity.userId());
        return identity;
    }
}
