package org.rangecache.backend.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rewrites date literals in a raw filter into the bare ISO form the remote side accepts
 * ({@code 2026-02-14}, no quotes, no time part).
 */
@Component
public class FilterNormalizer {

  private static final Logger log = LoggerFactory.getLogger(FilterNormalizer.class);

  private static final Pattern QUOTED_ISO = Pattern.compile("['\"](\\d{4}-\\d{2}-\\d{2})(?:T[^'\"]*)?['\"]");
  private static final Pattern ISO_TIMESTAMP = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})T\\d{2}:\\d{2}:\\d{2}[Z\\d:.+\\-]*");
  private static final Pattern US_DATE = Pattern.compile(
      "(\\d{1,2})/(\\d{1,2})/(\\d{4})(?:\\s+\\d{1,2}:\\d{2}:\\d{2}\\s*(?:AM|PM)?)?");
  private static final Pattern QUOTED_BARE_ISO = Pattern.compile("['\"](\\d{4}-\\d{2}-\\d{2})['\"]");

  public String normalize(String filter) {
    if (filter == null || filter.isBlank()) return filter;

    String out = QUOTED_ISO.matcher(filter).replaceAll("$1");
    out = ISO_TIMESTAMP.matcher(out).replaceAll("$1");

    Matcher m = US_DATE.matcher(out);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String iso = String.format("%s-%02d-%02d",
          m.group(3), Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
      m.appendReplacement(sb, iso);
    }
    m.appendTail(sb);
    out = QUOTED_BARE_ISO.matcher(sb.toString()).replaceAll("$1");

    if (!out.equals(filter)) {
      log.warn("⚠️ Normalized dates in filter: {} -> {}", filter, out);
    }
    return out;
  }
}
