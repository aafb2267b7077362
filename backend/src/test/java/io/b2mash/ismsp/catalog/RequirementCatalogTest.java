package io.b2mash.ismsp.catalog;

import static io.b2mash.ismsp.testutil.TestStore.requirement;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.ismsp.exception.NotFoundException;
import io.b2mash.ismsp.exception.StorageException;
import io.b2mash.ismsp.exception.ValidationException;
import io.b2mash.ismsp.testutil.TestStore;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RequirementCatalogTest {

  @TempDir Path tempDir;

  private TestStore testStore;
  private RequirementCatalog catalog;

  @BeforeEach
  void setUp() {
    testStore =
        TestStore.open(tempDir)
            .withRequirements(
                requirement("2.2.1", "인적보안", "주요 직무자 지정"),
                requirement("2.10.1", "시스템 및 서비스 보안 관리", "악성코드 통제"),
                requirement("1.1.1", "관리체계 기반 마련", "정책 수립"),
                requirement("1.1.2", "관리체계 기반 마련", "범위 설정"));
    catalog = testStore.catalog();
  }

  @AfterEach
  void tearDown() {
    testStore.close();
  }

  @Test
  void get_unknownItemCode_throwsNotFound() {
    assertThatThrownBy(() -> catalog.get("9.9.9")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void get_blankItemCode_throwsValidation() {
    assertThatThrownBy(() -> catalog.get("  ")).isInstanceOf(ValidationException.class);
  }

  @Test
  void list_ordersItemCodesLexicographically() {
    assertThat(catalog.list(null))
        .extracting(Requirement::itemCode)
        .containsExactly("1.1.1", "1.1.2", "2.10.1", "2.2.1");
  }

  @Test
  void list_categoryFilterMatchesSubstring() {
    assertThat(catalog.list("관리체계 기반 마련"))
        .extracting(Requirement::itemCode)
        .containsExactly("1.1.1", "1.1.2");
    assertThat(catalog.list("관리체계"))
        .extracting(Requirement::itemCode)
        .containsExactly("1.1.1", "1.1.2");
    assertThat(catalog.list("보안"))
        .extracting(Requirement::category)
        .containsOnly("시스템 및 서비스 보안 관리", "인적보안");
    assertThat(catalog.list("체계_기반")).isEmpty();
    assertThat(catalog.count("관리체계")).isEqualTo(2);
  }

  @Test
  void countAndCategories_reflectCatalog() {
    assertThat(catalog.count(null)).isEqualTo(4);
    assertThat(catalog.count("인적보안")).isEqualTo(1);
    assertThat(catalog.categories())
        .containsExactly("관리체계 기반 마련", "시스템 및 서비스 보안 관리", "인적보안");
  }

  @Test
  void save_updatesExistingItemAndDerivesMissingCategory() {
    catalog.save(new Requirement("1.1.1", null, "정책 수립 및 승인", "설명", "기준", null));

    var saved = catalog.get("1.1.1");
    assertThat(saved.title()).isEqualTo("정책 수립 및 승인");
    assertThat(saved.category()).isEqualTo("1");
    assertThat(saved.requirementText()).isEqualTo("기준");
    assertThat(catalog.count(null)).isEqualTo(4);
  }

  @Test
  void save_rejectsMalformedItemCodeAndMissingTitle() {
    assertThatThrownBy(() -> catalog.save(requirement("1.1", "x", "title")))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> catalog.save(requirement("1.1.9", "x", " ")))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void delete_referencedRequirement_isRejected() {
    testStore.evidenceStore().insert("1.1.1", "문서", "정책문서");

    assertThatThrownBy(() -> catalog.delete("1.1.1"))
        .isInstanceOf(ValidationException.class);
    assertThat(catalog.find("1.1.1")).isPresent();
  }

  @Test
  void delete_unreferencedRequirement_removesIt() {
    catalog.delete("1.1.2");

    assertThat(catalog.find("1.1.2")).isEmpty();
    assertThatThrownBy(() -> catalog.delete("1.1.2")).isInstanceOf(NotFoundException.class);
  }

  @Test
  void save_onCompatibilityView_isStorageError(@TempDir Path otherDir) {
    try (var viewStore = TestStore.open(otherDir)) {
      viewStore
          .jdbc()
          .sql("CREATE TABLE isms_requirements (item_code TEXT, item_title TEXT)")
          .update();

      assertThatThrownBy(() -> viewStore.catalog().save(requirement("1.1.1", "1", "Policy")))
          .isInstanceOf(StorageException.class)
          .hasMessageContaining("read-only");
    }
  }
}
