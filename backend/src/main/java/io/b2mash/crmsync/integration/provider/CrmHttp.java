package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.integration.CrmType;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/** Transport plumbing shared by the CRM adapters. */
final class CrmHttp {

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private CrmHttp() {}

  /**
   * Runs a remote call, translating transport failures (timeouts, refused connections, unreadable
   * bodies) into {@link CrmApiException}. Adapter exceptions pass through untouched.
   */
  static <T> T call(CrmType crmType, String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (ResourceAccessException e) {
      if (isTimeout(e)) {
        throw new CrmApiException(
            crmType, crmType.slug() + " request timed out during " + operation, null, e);
      }
      throw new CrmApiException(
          crmType, "Failed to connect to " + crmType.slug() + ": " + e.getMessage(), null, e);
    } catch (HttpMessageNotReadableException e) {
      throw malformedResponse(crmType, operation, e);
    } catch (RestClientException e) {
      // Body extraction failures arrive wrapped in a RestClientException
      if (hasCause(e, HttpMessageNotReadableException.class)) {
        throw malformedResponse(crmType, operation, e);
      }
      throw new CrmApiException(
          crmType, crmType.slug() + " " + operation + " failed: " + e.getMessage(), null, e);
    }
  }

  static URI uri(String baseUrl, String pathTemplate, Object... pathVariables) {
    return uri(baseUrl, pathTemplate, Map.of(), pathVariables);
  }

  /**
   * Builds an absolute URI. Path variables and query values are strictly encoded, so quotes,
   * equals signs and ampersands inside them survive intact.
   */
  static URI uri(
      String baseUrl, String pathTemplate, Map<String, ?> query, Object... pathVariables) {
    var builder = UriComponentsBuilder.fromUriString(baseUrl).path(pathTemplate);
    var values = new ArrayList<Object>(Arrays.asList(pathVariables));
    query.forEach(
        (name, value) -> {
          builder.queryParam(name, "{q" + values.size() + "}");
          values.add(value);
        });
    return builder.encode().buildAndExpand(values.toArray()).toUri();
  }

  /**
   * Checks a caller-supplied instance URL before any request is sent to it.
   *
   * @return the URL without a trailing slash
   * @throws CrmAuthenticationException if the URL is missing, malformed or not https
   */
  static String requireHttpsUrl(CrmType crmType, String url) {
    if (url == null) {
      throw new CrmAuthenticationException(crmType, "instance_url is required");
    }
    URI parsed;
    try {
      parsed = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new CrmAuthenticationException(crmType, "instance_url is not a valid URL");
    }
    if (!"https".equalsIgnoreCase(parsed.getScheme()) || parsed.getHost() == null) {
      throw new CrmAuthenticationException(crmType, "instance_url must be an https URL");
    }
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /** Parsed JSON object body; empty and mutable when the response has no body. */
  static Map<String, Object> readObject(ConvertibleClientHttpResponse response) {
    Map<String, Object> body = response.bodyTo(JSON_OBJECT);
    return body != null ? new LinkedHashMap<>(body) : new LinkedHashMap<>();
  }

  static String readText(ConvertibleClientHttpResponse response) {
    String body = response.bodyTo(String.class);
    if (body == null) {
      return "";
    }
    return body.length() > MAX_ERROR_BODY_LENGTH ? body.substring(0, MAX_ERROR_BODY_LENGTH) : body;
  }

  static CrmApiException apiError(
      CrmType crmType, String operation, int status, ConvertibleClientHttpResponse response) {
    return new CrmApiException(
        crmType,
        crmType.slug() + " API error during " + operation + " (" + status + "): "
            + readText(response),
        status);
  }

  /** Elements of a JSON array held under {@code key}; non-object elements are skipped. */
  @SuppressWarnings("unchecked")
  static List<Map<String, Object>> objectList(Map<String, Object> body, String key) {
    var value = body.get(key);
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    return list.stream()
        .filter(Map.class::isInstance)
        .map(item -> (Map<String, Object>) item)
        .toList();
  }

  /** Escapes a value placed inside a single-quoted SOQL literal. */
  static String soqlLiteral(String value) {
    return value.replace("\\", "\\\\").replace("'", "\\'");
  }

  /** Escapes a value placed inside a single-quoted OData literal. */
  static String odataLiteral(String value) {
    return value.replace("'", "''");
  }

  private static CrmApiException malformedResponse(
      CrmType crmType, String operation, Exception cause) {
    return new CrmApiException(
        crmType, "Malformed response from " + crmType.slug() + " during " + operation, null, cause);
  }

  private static boolean isTimeout(Throwable error) {
    return hasCause(error, SocketTimeoutException.class)
        || hasCause(error, HttpTimeoutException.class);
  }

  private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
    for (Throwable cause = error; cause != null; cause = cause.getCause()) {
      if (type.isInstance(cause)) {
        return true;
      }
    }
    return false;
  }
}
