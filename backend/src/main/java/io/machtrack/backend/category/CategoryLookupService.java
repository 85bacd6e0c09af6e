package io.machtrack.backend.category;

import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CategoryLookupService {

  private final CategoryRepository categoryRepository;

  public CategoryLookupService(CategoryRepository categoryRepository) {
    this.categoryRepository = categoryRepository;
  }

  @Transactional(readOnly = true)
  public Optional<CategoryRef> getCategory(UUID id) {
    if (id == null) {
      return Optional.empty();
    }
    return categoryRepository.findById(id).map(CategoryRef::from);
  }
}
