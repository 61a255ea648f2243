package com.scholary.streamvault.service;

import com.scholary.streamvault.error.DownloadException;
import com.scholary.streamvault.job.DownloadOptions;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Input checks run before anything is created.
 *
 * <p>URLs must be absolute http(s) URLs with a host, optionally restricted to an allow-list of
 * hosts (subdomains included). Filename templates must stay inside the download directory.
 */
public class SubmissionValidator {

  private final List<String> allowedHosts;

  public SubmissionValidator(List<String> allowedHosts) {
    this.allowedHosts =
        allowedHosts.stream().map(host -> host.trim().toLowerCase(Locale.ROOT)).toList();
  }

  /**
   * @return the trimmed URL
   * @throws DownloadException INVALID_URL
   */
  public String validateUrl(String url) {
    if (url == null || url.isBlank()) {
      throw DownloadException.invalidUrl("URL is required");
    }
    String trimmed = url.trim();
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException e) {
      throw DownloadException.invalidUrl("Malformed URL: " + trimmed);
    }
    String scheme = uri.getScheme();
    if (scheme == null
        || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw DownloadException.invalidUrl("Only http and https URLs are supported: " + trimmed);
    }
    String host = uri.getHost();
    if (host == null || host.isBlank()) {
      throw DownloadException.invalidUrl("URL has no host: " + trimmed);
    }
    if (!allowedHosts.isEmpty() && !isAllowed(host.toLowerCase(Locale.ROOT))) {
      throw DownloadException.invalidUrl("Host is not allowed: " + host);
    }
    return trimmed;
  }

  /**
   * @throws DownloadException INVALID_REQUEST for a template escaping the download directory
   */
  public void validateOptions(DownloadOptions options) {
    String template = options.filenameTemplate();
    if (template.startsWith("/")
        || template.startsWith("\\")
        || template.matches("^[A-Za-z]:.*")) {
      throw DownloadException.invalidRequest("Filename template must be relative: " + template);
    }
    if (template.contains("..")) {
      throw DownloadException.invalidRequest("Filename template must not contain '..'");
    }
  }

  /**
   * Parse an ISO-8601 instant ({@code 2030-01-01T10:00:00Z}) or offset date-time.
   *
   * @throws DownloadException INVALID_TIME
   */
  public Instant parseFireTime(String raw) {
    if (raw == null || raw.isBlank()) {
      throw DownloadException.invalidTime("Fire time is required");
    }
    String trimmed = raw.trim();
    try {
      return Instant.parse(trimmed);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(trimmed).toInstant();
      } catch (DateTimeParseException nested) {
        throw DownloadException.invalidTime("Unparseable fire time: " + trimmed);
      }
    }
  }

  private boolean isAllowed(String host) {
    for (String allowed : allowedHosts) {
      if (host.equals(allowed) || host.endsWith("." + allowed)) {
        return true;
      }
    }
    return false;
  }
}
