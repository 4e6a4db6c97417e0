package tech.yump.credstore.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Constraint(validatedBy = ProviderIdsValidator.class)
@Target({ ElementType.FIELD, ElementType.PARAMETER })
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidProviderIds {
  String message() default "Provider ids (credstore.providers) must be unique, lowercase and match [a-z0-9][a-z0-9_-]*.";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
