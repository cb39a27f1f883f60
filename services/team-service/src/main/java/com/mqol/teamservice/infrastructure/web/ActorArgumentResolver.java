package com.mqol.teamservice.infrastructure.web;

import com.mqol.observability.CorrelationContextHolder;
import com.mqol.teamservice.domain.Actor;
import com.mqol.teamservice.domain.UnauthenticatedException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentActor} parameters from the {@code X-Actor-Id} header set by the
 * upstream authentication layer.
 *
 * <p>A missing or blank header fails with {@link UnauthenticatedException} before the handler
 * runs, so no access decision is ever made for an anonymous caller.
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentActor.class)
                && Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Actor resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        String actorId = webRequest.getHeader(ACTOR_HEADER);
        if (actorId == null || actorId.isBlank()) {
            throw new UnauthenticatedException("Missing " + ACTOR_HEADER + " header");
        }
        Actor actor = new Actor(actorId.strip());
        CorrelationContextHolder.update(ctx -> ctx.withActor(actor.id()));
        return actor;
    }
}
