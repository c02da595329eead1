package com.example.finance.fincheck.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wraps every API payload: {@code data} on success, {@code errors} when the request itself could
 * not be processed. Field-level validation failures travel inside {@code data}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationEnvelope<T> {

  private T data;
  private List<String> errors;

  public static <T> ValidationEnvelope<T> of(T data) {
    return ValidationEnvelope.<T>builder().data(data).errors(List.of()).build();
  }

  public static <T> ValidationEnvelope<T> failure(List<String> errors) {
    return ValidationEnvelope.<T>builder().errors(List.copyOf(errors)).build();
  }
}
