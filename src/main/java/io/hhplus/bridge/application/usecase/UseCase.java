package io.hhplus.bridge.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 애플리케이션 유스케이스 (execute 메서드 하나를 갖는 컴포넌트)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}
