package io.machtrack.backend.sequence;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Pure encode/decode of sequence identifiers. Parsed templates are cached by their source string
 * so a template is tokenised once however many identifiers are rendered with it.
 */
public class SequenceCodec {

  private final Cache<String, SequenceTemplate> templateCache;

  public SequenceCodec(long templateCacheSize) {
    this.templateCache = Caffeine.newBuilder().maximumSize(templateCacheSize).build();
  }

  /** Returns the parsed form of {@code source}. Does not validate it. */
  public SequenceTemplate template(String source) {
    return templateCache.get(source, SequenceTemplate::parse);
  }

  public String encode(String template, String categorySlug, String subcategorySlug, long number) {
    return encode(template(template), categorySlug, subcategorySlug, number);
  }

  public String encode(
      SequenceTemplate template, String categorySlug, String subcategorySlug, long number) {
    return template.render(categorySlug, subcategorySlug, number);
  }

  /**
   * Recovers the number embedded in {@code identifier}, trying each {@link SequenceDecodeStrategy}
   * in declaration order. Returns empty when no strategy matches; callers treat that as a skip.
   *
   * @param oldTemplate the template the identifier is believed to have been rendered with
   * @param subcategorySlug the subcategory slug, {@code ""} when the scope has none, or {@code
   *     null} when unknown
   */
  public Optional<DecodedSequence> decode(
      String identifier, String oldTemplate, String categorySlug, String subcategorySlug) {
    if (identifier == null || identifier.isBlank()) {
      return Optional.empty();
    }
    var parsed = oldTemplate != null ? template(oldTemplate) : null;
    var context = new SequenceDecodeStrategy.Context(parsed, categorySlug, subcategorySlug);
    for (SequenceDecodeStrategy strategy : SequenceDecodeStrategy.values()) {
      OptionalLong number = strategy.decode(identifier.trim(), context);
      if (number.isPresent()) {
        return Optional.of(new DecodedSequence(number.getAsLong(), strategy));
      }
    }
    return Optional.empty();
  }
}
