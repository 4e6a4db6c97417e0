package tech.yump.credstore.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import tech.yump.credstore.provider.Provider;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ProviderIdsValidator implements ConstraintValidator<ValidProviderIds, List<String>> {

  @Override
  public boolean isValid(List<String> value, ConstraintValidatorContext context) {
    if (value == null) {
      return true; // @NotEmpty reports the missing list
    }

    Set<String> seen = new HashSet<>();
    for (String id : value) {
      if (id == null || !Provider.ID_PATTERN.matcher(id).matches()) {
        return false;
      }
      if (!seen.add(id)) {
        return false;
      }
    }
    return true;
  }
}
