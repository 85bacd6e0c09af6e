package io.machtrack.backend.sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A sequence template parsed into typed segments. Templates are strings such as {@code
 * "{category}-{subcategory}-{sequence}"}; everything that is not one of the three tokens is a
 * literal.
 *
 * <p>Parsing never fails, so historical templates that would no longer be accepted can still be
 * used for decoding. {@link #validate()} enforces the rules a template must satisfy before it is
 * stored on a configuration.
 */
public final class SequenceTemplate {

  public static final String CATEGORY_TOKEN = "{category}";
  public static final String SUBCATEGORY_TOKEN = "{subcategory}";
  public static final String SEQUENCE_TOKEN = "{sequence}";

  static final int MIN_SEQUENCE_WIDTH = 3;

  private static final Pattern HYPHEN_RUN = Pattern.compile("-{2,}");
  private static final String OPEN_SLUG_CLASS = "([A-Z0-9-]*)";

  // Placeholders used while building a match pattern; neither can occur in a rendered identifier.
  private static final char SEQUENCE_MARK = '\u0000';
  private static final char OPEN_SLUG_MARK = '\u0001';

  public enum SegmentType {
    LITERAL,
    CATEGORY,
    SUBCATEGORY,
    SEQUENCE
  }

  public record Segment(SegmentType type, String text) {

    static Segment literal(String text) {
      return new Segment(SegmentType.LITERAL, text);
    }

    static Segment token(SegmentType type) {
      return new Segment(type, null);
    }
  }

  /** Compiled structural pattern plus the index of the group that captures the sequence number. */
  public record MatchPattern(Pattern pattern, int sequenceGroup) {}

  private final String source;
  private final List<Segment> segments;

  private SequenceTemplate(String source, List<Segment> segments) {
    this.source = source;
    this.segments = List.copyOf(segments);
  }

  public static SequenceTemplate parse(String source) {
    Objects.requireNonNull(source, "template must not be null");
    var segments = new ArrayList<Segment>();
    var literal = new StringBuilder();
    int i = 0;
    while (i < source.length()) {
      SegmentType token = tokenAt(source, i);
      if (token == null) {
        literal.append(source.charAt(i));
        i++;
        continue;
      }
      if (literal.length() > 0) {
        segments.add(Segment.literal(literal.toString()));
        literal.setLength(0);
      }
      segments.add(Segment.token(token));
      i += tokenText(token).length();
    }
    if (literal.length() > 0) {
      segments.add(Segment.literal(literal.toString()));
    }
    return new SequenceTemplate(source, segments);
  }

  private static SegmentType tokenAt(String source, int index) {
    if (source.startsWith(CATEGORY_TOKEN, index)) {
      return SegmentType.CATEGORY;
    }
    if (source.startsWith(SUBCATEGORY_TOKEN, index)) {
      return SegmentType.SUBCATEGORY;
    }
    if (source.startsWith(SEQUENCE_TOKEN, index)) {
      return SegmentType.SEQUENCE;
    }
    return null;
  }

  private static String tokenText(SegmentType type) {
    return switch (type) {
      case CATEGORY -> CATEGORY_TOKEN;
      case SUBCATEGORY -> SUBCATEGORY_TOKEN;
      case SEQUENCE -> SEQUENCE_TOKEN;
      case LITERAL -> throw new IllegalArgumentException("Literal segments have no token text");
    };
  }

  /**
   * Rejects templates that cannot produce unique identifiers: both {@code {category}} and {@code
   * {sequence}} must be present, and {@code {sequence}} at most once.
   *
   * @throws SequenceException with {@link SequenceErrorCode#INVALID_TEMPLATE}
   */
  public SequenceTemplate validate() {
    if (count(SegmentType.CATEGORY) == 0 || count(SegmentType.SEQUENCE) == 0) {
      throw SequenceException.invalidTemplate(
          "Template must contain "
              + CATEGORY_TOKEN
              + " and "
              + SEQUENCE_TOKEN
              + " placeholders: "
              + source);
    }
    if (count(SegmentType.SEQUENCE) > 1) {
      throw SequenceException.invalidTemplate(
          "Template must contain " + SEQUENCE_TOKEN + " exactly once: " + source);
    }
    return this;
  }

  /**
   * Renders an identifier. Slugs are uppercased, a missing subcategory renders as an empty string,
   * the number is zero-padded to three digits, and the result goes through {@link
   * #collapseHyphens(String)}.
   */
  public String render(String categorySlug, String subcategorySlug, long number) {
    var out = new StringBuilder();
    for (Segment segment : segments) {
      switch (segment.type()) {
        case LITERAL -> out.append(segment.text());
        case CATEGORY -> out.append(upper(categorySlug));
        case SUBCATEGORY -> out.append(upper(subcategorySlug));
        case SEQUENCE -> out.append(padSequence(number));
      }
    }
    return collapseHyphens(out.toString());
  }

  /**
   * Builds the structural pattern used to recover the number from an identifier this template
   * rendered. Known slugs become quoted literals; a {@code null} slug is unknown and becomes an
   * open {@code [A-Z0-9-]*} group. Only the first {@code {sequence}} is captured.
   *
   * @throws IllegalStateException if the template has no {@code {sequence}} token
   */
  public MatchPattern toMatchPattern(String categorySlug, String subcategorySlug) {
    var skeleton = new StringBuilder();
    for (Segment segment : segments) {
      switch (segment.type()) {
        case LITERAL -> skeleton.append(segment.text());
        case CATEGORY -> appendSlugOrMark(skeleton, categorySlug);
        case SUBCATEGORY -> appendSlugOrMark(skeleton, subcategorySlug);
        case SEQUENCE -> skeleton.append(SEQUENCE_MARK);
      }
    }
    String collapsed = collapseHyphens(skeleton.toString());

    var regex = new StringBuilder("^");
    var literal = new StringBuilder();
    int openGroups = 0;
    int sequenceGroup = -1;
    for (int i = 0; i < collapsed.length(); i++) {
      char c = collapsed.charAt(i);
      if (c != SEQUENCE_MARK && c != OPEN_SLUG_MARK) {
        literal.append(c);
        continue;
      }
      if (literal.length() > 0) {
        regex.append(Pattern.quote(literal.toString()));
        literal.setLength(0);
      }
      if (c == OPEN_SLUG_MARK) {
        regex.append(OPEN_SLUG_CLASS);
        openGroups++;
      } else if (sequenceGroup < 0) {
        regex.append("(\\d+)");
        sequenceGroup = openGroups + 1;
      } else {
        regex.append("\\d+");
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    regex.append('$');

    if (sequenceGroup < 0) {
      throw new IllegalStateException("Template has no " + SEQUENCE_TOKEN + " token: " + source);
    }
    return new MatchPattern(
        Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE), sequenceGroup);
  }

  private static void appendSlugOrMark(StringBuilder skeleton, String slug) {
    if (slug == null) {
      skeleton.append(OPEN_SLUG_MARK);
    } else {
      skeleton.append(upper(slug));
    }
  }

  /** Collapses runs of hyphens into one, then strips a single leading and trailing hyphen. */
  static String collapseHyphens(String value) {
    String collapsed = HYPHEN_RUN.matcher(value).replaceAll("-");
    if (collapsed.startsWith("-")) {
      collapsed = collapsed.substring(1);
    }
    if (collapsed.endsWith("-")) {
      collapsed = collapsed.substring(0, collapsed.length() - 1);
    }
    return collapsed;
  }

  static String padSequence(long number) {
    return String.format("%0" + MIN_SEQUENCE_WIDTH + "d", number);
  }

  private static String upper(String slug) {
    return slug == null ? "" : slug.toUpperCase(Locale.ROOT);
  }

  private long count(SegmentType type) {
    return segments.stream().filter(s -> s.type() == type).count();
  }

  public List<Segment> segments() {
    return segments;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SequenceTemplate other && source.equals(other.source);
  }

  @Override
  public int hashCode() {
    return source.hashCode();
  }

  @Override
  public String toString() {
    return source;
  }
}
