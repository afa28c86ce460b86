package com.example.portalsync.web.filter;

import com.example.portalsync.web.rest.ApiConstants;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts the caller's request id (or a fresh one) into the logging context and echoes it back.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";
  public static final String MDC_KEY = "requestId";
  private static final Pattern SAFE_REQUEST_ID = Pattern.compile("^[a-zA-Z0-9\\-_.]{1,64}$");

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
                                  @NonNull HttpServletResponse response,
                                  @NonNull FilterChain filterChain) throws ServletException, IOException {
    String requestId = resolve(request.getHeader(ApiConstants.ApiHeader.REQUEST_ID));
    MDC.put(MDC_KEY, requestId);
    request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
    response.setHeader(ApiConstants.ApiHeader.REQUEST_ID, requestId);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_KEY);
    }
  }

  /**
   * The header value when it is a safe token, otherwise a random UUID.
   */
  public static String resolve(String header) {
    if (StringUtils.hasText(header) && SAFE_REQUEST_ID.matcher(header.trim()).matches()) {
      return header.trim();
    }
    return UUID.randomUUID().toString();
  }
}
