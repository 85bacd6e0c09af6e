package io.machtrack.backend.sequence;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ways of recovering the number embedded in an identifier, in the order {@link SequenceCodec}
 * tries them. Identifiers in the wild were produced by many template versions, so only the first
 * strategy relies on the template; the rest are increasingly permissive guesses.
 */
public enum SequenceDecodeStrategy {

  /** Rebuilds the template as a regular expression and reads the sequence group. */
  STRUCTURAL {
    @Override
    OptionalLong decode(String identifier, Context context) {
      try {
        var matchPattern =
            context.template().toMatchPattern(context.categorySlug(), context.subcategorySlug());
        Matcher matcher = matchPattern.pattern().matcher(identifier);
        if (!matcher.matches()) {
          return OptionalLong.empty();
        }
        return parse(matcher.group(matchPattern.sequenceGroup()));
      } catch (RuntimeException e) {
        // Malformed historical templates fall through to the heuristics
        log.debug(
            "Structural decode failed: identifier={}, template={}, reason={}",
            identifier,
            context.template(),
            e.getMessage());
        return OptionalLong.empty();
      }
    }
  },

  /** A zero-padded number with at least three significant digits, e.g. {@code 01234}. */
  PADDED_NUMBER {
    @Override
    OptionalLong decode(String identifier, Context context) {
      return firstGroup(PADDED, identifier);
    }
  },

  /** Any zero-padded number, e.g. {@code 007}. */
  ZERO_PADDED_NUMBER {
    @Override
    OptionalLong decode(String identifier, Context context) {
      return firstGroup(ZERO_PADDED, identifier);
    }
  },

  /** The last run of two or more digits, else the last run of digits. */
  BARE_DIGITS {
    @Override
    OptionalLong decode(String identifier, Context context) {
      Matcher matcher = DIGITS.matcher(identifier);
      String lastLong = null;
      String last = null;
      while (matcher.find()) {
        last = matcher.group();
        if (last.length() >= 2) {
          lastLong = last;
        }
      }
      if (lastLong != null) {
        return parse(lastLong);
      }
      return last != null ? parse(last) : OptionalLong.empty();
    }
  };

  private static final Logger log = LoggerFactory.getLogger(SequenceDecodeStrategy.class);

  private static final Pattern PADDED = Pattern.compile("\\b0+([1-9]\\d{2,})\\b");
  private static final Pattern ZERO_PADDED = Pattern.compile("\\b0+(\\d+)\\b");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  /** What a strategy knows about the identifier's origin. A {@code null} slug is unknown. */
  public record Context(SequenceTemplate template, String categorySlug, String subcategorySlug) {}

  abstract OptionalLong decode(String identifier, Context context);

  private static OptionalLong firstGroup(Pattern pattern, String identifier) {
    Matcher matcher = pattern.matcher(identifier);
    return matcher.find() ? parse(matcher.group(1)) : OptionalLong.empty();
  }

  private static OptionalLong parse(String digits) {
    try {
      return OptionalLong.of(Long.parseLong(digits));
    } catch (NumberFormatException e) {
      // Digit runs too long for a long are not sequence numbers
      return OptionalLong.empty();
    }
  }
}
