package io.b2mash.ismsp.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.ismsp.catalog.Requirement;
import io.b2mash.ismsp.exception.ValidationException;
import io.b2mash.ismsp.testutil.TestStore;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class KeywordSearchTest {

  private static final Requirement[] CATALOG = {
    new Requirement(
        "2.7.1",
        "암호화 적용",
        "암호정책 수립",
        "암호화 정책 및 절차",
        "암호화 적용 대상, 암호 알고리즘, 키 관리 등의 정책을 수립하여야 한다.",
        null),
    new Requirement(
        "3.2.2",
        "개인정보 보관 및 이용 시 보호조치",
        "암호화",
        "개인정보 암호화",
        "개인정보를 안전하게 저장·전송하기 위해 암호화하여야 한다.",
        null),
    new Requirement(
        "2.9.1",
        "시스템 및 서비스 운영 관리",
        "로그 관리",
        "Log retention",
        "Keep SYSTEM logs for 100% of hosts",
        null),
    new Requirement("1.1.1", "Management", "Policy", "Café ÉCOLE policy_owner", null, null)
  };

  @TempDir Path tempDir;

  private TestStore testStore;

  @AfterEach
  void tearDown() {
    testStore.close();
  }

  @Test
  void search_koreanKeyword_returnsMatchesByItemCode() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    assertThat(testStore.keywordSearch().search("암호"))
        .extracting(Requirement::itemCode)
        .containsExactly("2.7.1", "3.2.2");
  }

  @Test
  void search_asciiKeyword_ignoresCase() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    assertThat(testStore.keywordSearch().search("system LOGS"))
        .extracting(Requirement::itemCode)
        .containsExactly("2.9.1");
    assertThat(testStore.keywordSearch().search("management"))
        .extracting(Requirement::itemCode)
        .containsExactly("1.1.1");
  }

  @Test
  void search_nonAsciiKeyword_foldsUnicodeCase() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    assertThat(testStore.keywordSearch().search("école"))
        .extracting(Requirement::itemCode)
        .containsExactly("1.1.1");
  }

  @Test
  void search_likeWildcards_matchLiterally() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    assertThat(testStore.keywordSearch().search("100%"))
        .extracting(Requirement::itemCode)
        .containsExactly("2.9.1");
    assertThat(testStore.keywordSearch().search("y_o"))
        .extracting(Requirement::itemCode)
        .containsExactly("1.1.1");
    assertThat(testStore.keywordSearch().search("%")).hasSize(1);
  }

  @Test
  void search_surroundingWhitespace_isPartOfKeyword() {
    testStore =
        TestStore.open(tempDir)
            .withRequirements(TestStore.requirement("2.7.1", "암호화 적용", "암호정책수립"));

    assertThat(testStore.keywordSearch().search("정책"))
        .extracting(Requirement::itemCode)
        .containsExactly("2.7.1");
    assertThat(testStore.keywordSearch().search(" 정책")).isEmpty();
    assertThat(testStore.keywordSearch().search("정책 ")).isEmpty();
  }

  @Test
  void search_asciiKeyword_findsFieldsThatFoldToAscii(@TempDir Path plainDir) {
    var kelvin =
        new Requirement("4.1.1", "Facilities", "Server room at 300 \u212Aelvin", null, null, null);
    testStore = TestStore.open(tempDir).withRequirements(kelvin);
    try (var plain = TestStore.open(plainDir, false).withRequirements(kelvin)) {
      assertThat(testStore.keywordSearch().search("KELVIN"))
          .extracting(Requirement::itemCode)
          .containsExactly("4.1.1");
      assertThat(plain.keywordSearch().search("kelvin"))
          .extracting(Requirement::itemCode)
          .containsExactly("4.1.1");
      assertThat(testStore.keywordSearch().search("celsius")).isEmpty();
    }
  }

  @Test
  void search_noMatch_returnsEmptyList() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    assertThat(testStore.keywordSearch().search("블록체인")).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", " ", "\t"})
  void search_blankKeyword_throwsValidation(String keyword) {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    assertThatThrownBy(() -> testStore.keywordSearch().search(keyword))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void search_resultsAreIdenticalWithAndWithoutIndex(@TempDir Path plainDir) {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);
    try (var plain = TestStore.open(plainDir, false).withRequirements(CATALOG)) {
      assertThat(testStore.schemaAdapter().requireSource().searchIndexed()).isTrue();
      assertThat(plain.schemaAdapter().requireSource().searchIndexed()).isFalse();

      for (String keyword : List.of("암호", "정책", "log", "POLICY", "école", "%", "1", "관리")) {
        assertThat(testStore.keywordSearch().search(keyword))
            .as("keyword %s", keyword)
            .isEqualTo(plain.keywordSearch().search(keyword));
      }
    }
  }

  @Test
  void search_capsResultsAtMaxResults() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);
    var capped =
        new KeywordSearch(
            testStore.schemaAdapter(), testStore.store(), new SearchProperties(true, 1));

    assertThat(capped.search("암호")).extracting(Requirement::itemCode).containsExactly("2.7.1");
  }

  @Test
  void search_indexFollowsLaterWrites() {
    testStore = TestStore.open(tempDir).withRequirements(CATALOG);

    testStore
        .catalog()
        .save(new Requirement("2.5.1", "인증 및 권한 관리", "Account lifecycle", null, null, null));

    assertThat(testStore.keywordSearch().search("LIFECYCLE"))
        .extracting(Requirement::itemCode)
        .containsExactly("2.5.1");
  }
}
