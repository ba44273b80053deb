package com.shopadmin.backend.global.security.permission;

import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces {@link RequiresPermission} and {@link RequiresAnyPermission} on controller handlers.
 * A method-level annotation replaces one declared on the controller class.
 */
@Component
public class PermissionEnforcementInterceptor implements HandlerInterceptor {

    private final PermissionGuard guard;

    public PermissionEnforcementInterceptor(PermissionGuard guard) {
        this.guard = guard;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }

        RequiresPermission single = handlerMethod.getMethodAnnotation(RequiresPermission.class);
        RequiresAnyPermission any = handlerMethod.getMethodAnnotation(RequiresAnyPermission.class);
        if (single == null && any == null) {
            single = classAnnotation(handlerMethod, RequiresPermission.class);
            any = classAnnotation(handlerMethod, RequiresAnyPermission.class);
        }

        if (single != null) {
            guard.require(request, toRequirement(request, single));
        } else if (any != null) {
            List<PermissionRequirement> alternatives = Arrays.stream(any.value())
                    .map(annotation -> toRequirement(request, annotation))
                    .toList();
            guard.requireAny(request, alternatives);
        }
        return true;
    }

    private static <A extends Annotation> A classAnnotation(HandlerMethod handlerMethod, Class<A> type) {
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), type);
    }

    private static PermissionRequirement toRequirement(HttpServletRequest request, RequiresPermission annotation) {
        return new PermissionRequirement(annotation.resource(), annotation.action(),
                resolveResourceId(request, annotation.resourceIdParam()));
    }

    private static String resolveResourceId(HttpServletRequest request, String parameterName) {
        if (parameterName == null || parameterName.isBlank()) {
            return null;
        }
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> pathVariables) {
            Object value = pathVariables.get(parameterName);
            if (value != null) {
                return value.toString();
            }
        }
        return request.getParameter(parameterName);
    }
}
