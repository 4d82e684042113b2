package com.evoila.tenantplugin.security.config;

import com.evoila.tenantplugin.tenant.TenantConfigException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.webflux.error.ErrorWebExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps every failure of a generator call to a plain-text response. Upstream details are logged
 * here and never written to the caller.
 */
@Slf4j
@Configuration
@Order(-2) // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {

  static final String INTERNAL_ERROR_BODY = "internal error";
  static final String BAD_REQUEST_BODY = "bad request";

  @Override
  public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
    if (exchange.getResponse().isCommitted()) {
      log.error("Failure after response was committed", ex);
      return Mono.error(ex);
    }

    ErrorInfo errorInfo = determineErrorResponse(exchange, ex);
    return writeErrorResponse(exchange, errorInfo);
  }

  private ErrorInfo determineErrorResponse(ServerWebExchange exchange, Throwable ex) {
    String path = exchange.getRequest().getPath().value();

    if (ex instanceof AuthenticationException || ex instanceof AccessDeniedException) {
      log.warn("Access denied for {}: {}", path, ex.getMessage());
      return new ErrorInfo(HttpStatus.FORBIDDEN, SecurityConfig.FORBIDDEN_BODY);
    }
    if (ex instanceof TenantConfigException) {
      log.error("internal-error: tenant configuration lookup failed for {}", path, ex);
      return ErrorInfo.internal();
    }
    if (ex instanceof TimeoutException) {
      log.error("internal-error: generator call on {} timed out: {}", path, ex.getMessage());
      return ErrorInfo.internal();
    }
    if (ex instanceof ServerWebInputException inputException) {
      log.warn("Invalid generator request on {}: {}", path, inputException.getReason());
      return new ErrorInfo(HttpStatus.BAD_REQUEST, BAD_REQUEST_BODY);
    }
    if (ex instanceof ResponseStatusException statusException) {
      HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
      if (status != null && !status.is5xxServerError()) {
        log.debug("Response status {} for {}", status.value(), path);
        return new ErrorInfo(status, status.getReasonPhrase());
      }
    }

    log.error("internal-error: unhandled exception on {}", path, ex);
    return ErrorInfo.internal();
  }

  private Mono<Void> writeErrorResponse(ServerWebExchange exchange, ErrorInfo errorInfo) {
    exchange.getResponse().setStatusCode(errorInfo.status());
    exchange.getResponse().getHeaders().setContentType(MediaType.TEXT_PLAIN);

    DataBuffer buffer =
        exchange
            .getResponse()
            .bufferFactory()
            .wrap(errorInfo.body().getBytes(StandardCharsets.UTF_8));
    return exchange.getResponse().writeWith(Mono.just(buffer));
  }

  /** Internal record for passing error info between methods */
  private record ErrorInfo(HttpStatus status, String body) {

    static ErrorInfo internal() {
      return new ErrorInfo(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_BODY);
    }
  }
}
