package io.machtrack.backend.sequence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.machtrack.backend.sequence.dto.CreateSequenceConfigRequest;
import io.machtrack.backend.sequence.dto.UpdateSequenceConfigRequest;
import io.machtrack.backend.testutil.TestEntities;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class SequenceConfigServiceTest {

  private static final UUID ACTOR_ID = UUID.randomUUID();
  private static final UUID CATEGORY_ID = UUID.randomUUID();
  private static final UUID CONFIG_ID = UUID.randomUUID();
  private static final SequenceScope SCOPE = SequenceScope.categoryWide(CATEGORY_ID);
  private static final String TEMPLATE = "{category}-{sequence}";

  @Mock private SequenceConfigRepository repository;
  @Mock private ScopeSlugResolver slugResolver;
  @Mock private SequenceReformatMigrator reformatMigrator;
  @Mock private TransactionTemplate transactionTemplate;
  @Mock private TransactionStatus transactionStatus;

  private SequenceConfigService service;

  @BeforeEach
  void setUp() {
    service =
        new SequenceConfigService(
            repository,
            slugResolver,
            new SequenceCodec(10),
            reformatMigrator,
            transactionTemplate);
  }

  private void givenSaveReturnsEntity() {
    when(repository.saveAndFlush(any(SequenceConfig.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  @SuppressWarnings("unchecked")
  private void givenTransactionRunsCallback() {
    when(transactionTemplate.execute(any()))
        .thenAnswer(
            invocation ->
                ((TransactionCallback<Object>) invocation.getArgument(0))
                    .doInTransaction(transactionStatus));
  }

  private SequenceConfig givenStoredConfig(long startingNumber, long currentSequence) {
    var config = TestEntities.config(CONFIG_ID, SCOPE, TEMPLATE, startingNumber, currentSequence);
    when(repository.findById(CONFIG_ID)).thenReturn(Optional.of(config));
    return config;
  }

  @Test
  void create_startsCounterBeforeStartingNumber() {
    givenSaveReturnsEntity();

    var response =
        service.create(
            new CreateSequenceConfigRequest(CATEGORY_ID, null, "mix", 100L, TEMPLATE), ACTOR_ID);

    assertThat(response.sequencePrefix()).isEqualTo("MIX");
    assertThat(response.startingNumber()).isEqualTo(100);
    assertThat(response.currentSequence()).isEqualTo(99);
    assertThat(response.active()).isTrue();
    assertThat(response.createdBy()).isEqualTo(ACTOR_ID);
    verify(slugResolver).resolve(SCOPE);
  }

  @Test
  void create_rejectsMissingTemplate() {
    assertThatThrownBy(
            () ->
                service.create(
                    new CreateSequenceConfigRequest(CATEGORY_ID, null, "MIX", 1L, null),
                    ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex -> assertThat(ex.getErrorCode()).isEqualTo(SequenceErrorCode.INVALID_TEMPLATE));
    verifyNoInteractions(slugResolver);
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void create_rejectsTemplateWithoutSequence() {
    assertThatThrownBy(
            () ->
                service.create(
                    new CreateSequenceConfigRequest(CATEGORY_ID, null, "MIX", 1L, "{category}"),
                    ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex -> assertThat(ex.getErrorCode()).isEqualTo(SequenceErrorCode.INVALID_TEMPLATE));
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void create_rejectsStartingNumberBelowOne() {
    assertThatThrownBy(
            () ->
                service.create(
                    new CreateSequenceConfigRequest(CATEGORY_ID, null, "MIX", 0L, TEMPLATE),
                    ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex ->
                assertThat(ex.getErrorCode())
                    .isEqualTo(SequenceErrorCode.INVALID_STARTING_NUMBER));
  }

  @Test
  void create_rejectsMalformedPrefix() {
    assertThatThrownBy(
            () ->
                service.create(
                    new CreateSequenceConfigRequest(
                        CATEGORY_ID, null, "MACHINE_TOOL", 1L, TEMPLATE),
                    ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex -> assertThat(ex.getErrorCode()).isEqualTo(SequenceErrorCode.INVALID_PREFIX));
  }

  @Test
  void create_rejectsSecondConfigForSameScope() {
    var existing = TestEntities.config(UUID.randomUUID(), SCOPE, TEMPLATE, 1, 0);
    when(repository.findByScope(SCOPE)).thenReturn(Optional.of(existing));

    assertThatThrownBy(
            () ->
                service.create(
                    new CreateSequenceConfigRequest(CATEGORY_ID, null, "MIX", 1L, TEMPLATE),
                    ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex -> assertThat(ex.getErrorCode()).isEqualTo(SequenceErrorCode.DUPLICATE_CONFIG));
    verify(repository, never()).saveAndFlush(any());
  }

  @Test
  void update_changedStartingNumberRewindsCounter() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest(null, 50L, null, null, null, null),
            ACTOR_ID);

    assertThat(response.config().startingNumber()).isEqualTo(50);
    assertThat(response.config().currentSequence()).isEqualTo(49);
    assertThat(response.reformat()).isNull();
  }

  @Test
  void update_sameStartingNumberKeepsCounter() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);

    var response =
        service.update(
            CONFIG_ID, new UpdateSequenceConfigRequest(null, 1L, null, null, null, null), ACTOR_ID);

    assertThat(response.config().currentSequence()).isEqualTo(12);
  }

  @Test
  void update_templateOnlyKeepsCounterAndSkipsReformat() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest(
                null, null, "M-{category}-{sequence}", null, null, null),
            ACTOR_ID);

    assertThat(response.config().template()).isEqualTo("M-{category}-{sequence}");
    assertThat(response.config().currentSequence()).isEqualTo(12);
    verifyNoInteractions(reformatMigrator);
  }

  @Test
  void update_reformatsExistingWhenRequested() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);
    var report = new ReformatReport(false, 3, 3, 0, 0, 0, Map.of(), List.of(), List.of());
    when(reformatMigrator.reformat(SCOPE, TEMPLATE, "M-{category}-{sequence}", ACTOR_ID))
        .thenReturn(report);

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest(
                null, null, "M-{category}-{sequence}", null, true, null),
            ACTOR_ID);

    assertThat(response.reformat()).isSameAs(report);
    assertThat(response.reformatError()).isNull();
    verify(transactionStatus, never()).setRollbackOnly();
  }

  @Test
  void update_reformatThatCannotStartKeepsSavedTemplate() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);
    when(reformatMigrator.reformat(SCOPE, TEMPLATE, "M-{category}-{sequence}", ACTOR_ID))
        .thenThrow(SequenceException.referenceNotFound("category", CATEGORY_ID));

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest(
                null, null, "M-{category}-{sequence}", null, true, null),
            ACTOR_ID);

    assertThat(response.config().template()).isEqualTo("M-{category}-{sequence}");
    assertThat(response.reformat()).isNull();
    assertThat(response.reformatError()).isEqualTo("No category found with id " + CATEGORY_ID);
  }

  @Test
  void update_dryRunRollsBackAndPreviewsReformat() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);
    var preview = new ReformatReport(true, 3, 3, 0, 0, 0, Map.of(), List.of(), List.of());
    when(reformatMigrator.preview(SCOPE, TEMPLATE, "M-{category}-{sequence}"))
        .thenReturn(preview);

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest(
                null, null, "M-{category}-{sequence}", null, true, true),
            ACTOR_ID);

    assertThat(response.reformat()).isSameAs(preview);
    assertThat(response.config().template()).isEqualTo("M-{category}-{sequence}");
    verify(transactionStatus).setRollbackOnly();
    verify(reformatMigrator, never()).reformat(any(), any(), any(), any());
  }

  @Test
  void update_reformatIsSkippedWhenTemplateUnchanged() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest("pmp", null, TEMPLATE, null, true, null),
            ACTOR_ID);

    assertThat(response.config().sequencePrefix()).isEqualTo("PMP");
    assertThat(response.reformat()).isNull();
    verifyNoInteractions(reformatMigrator);
  }

  @Test
  void update_rejectsInvalidTemplate() {
    givenTransactionRunsCallback();
    givenStoredConfig(1, 12);

    assertThatThrownBy(
            () ->
                service.update(
                    CONFIG_ID,
                    new UpdateSequenceConfigRequest(null, null, "{sequence}", null, null, null),
                    ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex -> assertThat(ex.getErrorCode()).isEqualTo(SequenceErrorCode.INVALID_TEMPLATE));
  }

  @Test
  void update_canDeactivate() {
    givenTransactionRunsCallback();
    givenSaveReturnsEntity();
    givenStoredConfig(1, 12);

    var response =
        service.update(
            CONFIG_ID,
            new UpdateSequenceConfigRequest(null, null, null, false, null, null),
            ACTOR_ID);

    assertThat(response.config().active()).isFalse();
    assertThat(response.config().updatedBy()).isEqualTo(ACTOR_ID);
  }

  @Test
  void reset_setsCounterBelowNewStart() {
    givenSaveReturnsEntity();
    givenStoredConfig(1, 40);

    var response = service.reset(CONFIG_ID, 500L, ACTOR_ID);

    assertThat(response.startingNumber()).isEqualTo(500);
    assertThat(response.currentSequence()).isEqualTo(499);
  }

  @Test
  void reset_rejectsZero() {
    assertThatThrownBy(() -> service.reset(CONFIG_ID, 0L, ACTOR_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex ->
                assertThat(ex.getErrorCode())
                    .isEqualTo(SequenceErrorCode.INVALID_STARTING_NUMBER));
  }

  @Test
  void get_unknownIdIsConfigNotFound() {
    when(repository.findById(CONFIG_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.get(CONFIG_ID))
        .isInstanceOfSatisfying(
            SequenceException.class,
            ex -> assertThat(ex.getErrorCode()).isEqualTo(SequenceErrorCode.CONFIG_NOT_FOUND));
  }

  @Test
  void delete_removesConfig() {
    var config = givenStoredConfig(1, 3);

    service.delete(CONFIG_ID, ACTOR_ID);

    verify(repository).delete(config);
  }
}
