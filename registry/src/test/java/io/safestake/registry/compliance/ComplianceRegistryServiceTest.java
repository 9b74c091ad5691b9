package io.safestake.registry.compliance;

import static io.safestake.registry.support.RegistryFixtures.ALICE;
import static io.safestake.registry.support.RegistryFixtures.BOB;
import static io.safestake.registry.support.RegistryFixtures.CHARLIE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.safestake.attestation.AttestationSigner;
import io.safestake.registry.account.ComplianceRecord;
import io.safestake.registry.account.InMemoryAccountStore;
import io.safestake.registry.attestation.AttestationVerifier;
import io.safestake.registry.config.RegistryProperties;
import io.safestake.registry.eligibility.EligibilityDecision;
import io.safestake.registry.eligibility.EligibilityEngine;
import io.safestake.registry.eligibility.EligibilityStatus;
import io.safestake.registry.outbox.ComplianceEventPublisher;
import io.safestake.registry.support.MutableClock;
import io.safestake.registry.support.RegistryFixtures;
import io.safestake.registry.support.SynchronizedTransactionOperations;
import io.safestake.registry.window.TimeWindowTracker;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class ComplianceRegistryServiceTest {

    private static final Instant START = Instant.parse("2026-03-10T09:00:00Z");

    @Mock
    private ComplianceEventPublisher eventPublisher;

    private final AttestationSigner attestor = RegistryFixtures.attestor();
    private InMemoryAccountStore accountStore;
    private MutableClock clock;
    private ComplianceRegistryService service;

    @BeforeEach
    void setUp() {
        accountStore = new InMemoryAccountStore();
        clock = new MutableClock(START);
        service = service(TransactionOperations.withoutTransaction());
    }

    private ComplianceRegistryService service(TransactionOperations transactionOperations) {
        RegistryProperties properties = RegistryFixtures.properties();
        TimeWindowTracker tracker = new TimeWindowTracker(properties);
        return new ComplianceRegistryService(
            accountStore,
            new AttestationVerifier(properties),
            tracker,
            new EligibilityEngine(tracker),
            new AccountLockManager(16, 500L),
            transactionOperations,
            eventPublisher,
            new ObjectMapper(),
            properties,
            clock
        );
    }

    @Test
    @DisplayName("등록, 한도 설정, 거래, 한도 초과, self-exclusion 순서의 전체 흐름")
    void fullComplianceLifecycle() {
        // given: 인증된 사용자 등록 후 100/1000 한도 설정
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);

        // when: 60 거래는 통과하고 추가 60은 daily 한도에 막힌다
        ComplianceRecord afterFirst = service.recordTransaction(ALICE, 60L, "platform-a");

        // then
        assertThat(afterFirst.getDailySpent()).isEqualTo(60L);
        assertThat(afterFirst.getMonthlySpent()).isEqualTo(60L);
        assertRegistryError(() -> service.recordTransaction(ALICE, 60L, "platform-a"), RegistryError.DAILY_LIMIT_REACHED);
        assertThat(accountStore.find(ALICE).orElseThrow().getDailySpent()).isEqualTo(60L);

        // self-exclusion 이후에는 소액도 막힌다
        service.selfExclude(ALICE, 30);
        assertThat(service.checkEligibility(ALICE, 1L).status()).isEqualTo(EligibilityStatus.SELF_EXCLUDED);
        assertRegistryError(() -> service.recordTransaction(ALICE, 1L, "platform-a"), RegistryError.SELF_EXCLUDED);
    }

    @Test
    @DisplayName("다른 계정 주소에 대한 서명으로는 등록할 수 없다")
    void signatureForAnotherAccountShouldBeRejected() {
        byte[] signatureForCharlie = attestor.sign(CHARLIE);

        assertRegistryError(() -> service.registerUser(BOB, signatureForCharlie), RegistryError.INVALID_SIGNATURE);
        assertThat(accountStore.exists(BOB)).isFalse();
        verify(eventPublisher, never()).publish(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("설정되지 않은 attestor 키로 서명하면 INVALID_SIGNATURE이다")
    void signatureFromRogueAttestorShouldBeRejected() {
        byte[] rogueSignature = RegistryFixtures.signerWithSeed(7).sign(ALICE);

        assertRegistryError(() -> service.registerUser(ALICE, rogueSignature), RegistryError.INVALID_SIGNATURE);
    }

    @Test
    @DisplayName("길이가 잘못된 서명은 예외 없이 INVALID_SIGNATURE로 처리한다")
    void malformedSignatureShouldBeRejected() {
        assertRegistryError(() -> service.registerUser(ALICE, new byte[12]), RegistryError.INVALID_SIGNATURE);
        assertRegistryError(() -> service.registerUser(ALICE, null), RegistryError.INVALID_SIGNATURE);
    }

    @Test
    @DisplayName("이미 등록된 계정은 ALREADY_REGISTERED이고 기존 레코드는 그대로다")
    void secondRegistrationShouldFail() {
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);
        service.recordTransaction(ALICE, 25L, "platform-a");

        assertRegistryError(() -> register(ALICE), RegistryError.ALREADY_REGISTERED);

        ComplianceRecord record = accountStore.find(ALICE).orElseThrow();
        assertThat(record.getDailyLimit()).isEqualTo(100L);
        assertThat(record.getDailySpent()).isEqualTo(25L);
    }

    @Test
    @DisplayName("신규 등록 레코드는 age 인증 상태이고 spend는 0, bucket은 등록 시각 기준이다")
    void registrationShouldInitializeRecord() {
        ComplianceRecord record = register(ALICE);

        assertThat(record.isAgeVerified()).isTrue();
        assertThat(record.getDailySpent()).isZero();
        assertThat(record.getMonthlySpent()).isZero();
        assertThat(record.getLastResetDay()).isEqualTo(START.getEpochSecond() / 86_400);
        assertThat(record.getLastResetMonth()).isEqualTo(START.getEpochSecond() / (30 * 86_400));
        assertThat(record.getCooldownUntil()).isNull();
        assertThat(record.getSelfExcludedUntil()).isNull();
        verify(eventPublisher).publish(eq(ALICE), eq("UserRegistered"), any());
    }

    @Test
    @DisplayName("한도를 설정하기 전에는 기본 한도 0 때문에 거래할 수 없다")
    void defaultLimitsShouldBlockTransactions() {
        register(ALICE);

        assertThat(service.checkEligibility(ALICE, 1L).status()).isEqualTo(EligibilityStatus.DAILY_LIMIT_REACHED);
    }

    @Test
    @DisplayName("잘못된 한도 조합은 계정 상태와 무관하게 INVALID_LIMITS이다")
    void invalidLimitsShouldBeRejectedBeforeLookup() {
        assertRegistryError(() -> service.setLimits(ALICE, 0L, 100L), RegistryError.INVALID_LIMITS);
        assertRegistryError(() -> service.setLimits(ALICE, 100L, 0L), RegistryError.INVALID_LIMITS);
        assertRegistryError(() -> service.setLimits(ALICE, 200L, 100L), RegistryError.INVALID_LIMITS);
        assertRegistryError(() -> service.setLimits(ALICE, 100L, 100L), RegistryError.NOT_REGISTERED);
    }

    @Test
    @DisplayName("age 미인증 레코드는 한도를 설정할 수 없다")
    void unverifiedRecordShouldNotAcceptLimits() {
        // given: 저장소에 직접 넣은 미인증 레코드
        ComplianceRecord record = ComplianceRecord.registered(BOB, START, 0L, 0L, 0L, 0L);
        record.setAgeVerified(false);
        accountStore.create(record);

        assertRegistryError(() -> service.setLimits(BOB, 10L, 100L), RegistryError.AGE_NOT_VERIFIED);
        assertThat(service.checkEligibility(BOB, 0L).status()).isEqualTo(EligibilityStatus.AGE_NOT_VERIFIED);
    }

    @Test
    @DisplayName("한도를 spend 아래로 낮춰도 spend는 줄지 않고 이후 거래만 막힌다")
    void loweringLimitsShouldKeepSpend() {
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);
        service.recordTransaction(ALICE, 80L, "platform-a");

        ComplianceRecord record = service.setLimits(ALICE, 50L, 500L);

        assertThat(record.getDailySpent()).isEqualTo(80L);
        EligibilityDecision decision = service.checkEligibility(ALICE, 0L);
        assertThat(decision.status()).isEqualTo(EligibilityStatus.DAILY_LIMIT_REACHED);
        assertThat(decision.remainingDailyLimit()).isZero();
    }

    @Test
    @DisplayName("다음 날에는 daily spend가 리셋되고 monthly는 누적된다")
    void dailySpendShouldResetOnNextDay() {
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);
        service.recordTransaction(ALICE, 100L, "platform-a");
        assertThat(service.checkEligibility(ALICE, 1L).status()).isEqualTo(EligibilityStatus.DAILY_LIMIT_REACHED);

        // when: 하루가 지난다
        clock.advance(Duration.ofDays(1));

        // then
        assertThat(service.getRecord(ALICE).dailySpent()).isZero();
        ComplianceRecord record = service.recordTransaction(ALICE, 70L, "platform-b");
        assertThat(record.getDailySpent()).isEqualTo(70L);
        assertThat(record.getMonthlySpent()).isEqualTo(170L);
        assertThat(record.getPlatformsUsed()).containsExactlyInAnyOrder("platform-a", "platform-b");
    }

    @Test
    @DisplayName("30일 윈도우가 지나면 monthly spend도 리셋된다")
    void monthlySpendShouldResetAfterMonthWindow() {
        register(ALICE);
        service.setLimits(ALICE, 500L, 500L);
        service.recordTransaction(ALICE, 500L, "platform-a");
        assertThat(service.checkEligibility(ALICE, 1L).status()).isEqualTo(EligibilityStatus.DAILY_LIMIT_REACHED);

        clock.advance(Duration.ofDays(1));
        assertThat(service.checkEligibility(ALICE, 1L).status()).isEqualTo(EligibilityStatus.MONTHLY_LIMIT_REACHED);

        clock.advance(Duration.ofDays(30));
        ComplianceRecord record = service.recordTransaction(ALICE, 500L, "platform-a");
        assertThat(record.getMonthlySpent()).isEqualTo(500L);
    }

    @Test
    @DisplayName("조회는 리셋을 반영해 보여주지만 저장하지 않는다")
    void readsShouldNotPersistResets() {
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);
        service.recordTransaction(ALICE, 40L, "platform-a");
        clock.advance(Duration.ofDays(2));

        ComplianceView view = service.getRecord(ALICE);
        service.checkEligibility(ALICE, 10L);

        assertThat(view.dailySpent()).isZero();
        assertThat(view.remainingDailyLimit()).isEqualTo(100L);
        assertThat(accountStore.find(ALICE).orElseThrow().getDailySpent()).isEqualTo(40L);
    }

    @Test
    @DisplayName("음수 금액이나 빈 platformId 거래는 상태를 바꾸지 않는다")
    void invalidTransactionInputShouldBeRejected() {
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);

        assertRegistryError(() -> service.recordTransaction(ALICE, -5L, "platform-a"), RegistryError.INVALID_AMOUNT);
        assertRegistryError(() -> service.recordTransaction(ALICE, 5L, " "), RegistryError.INVALID_REQUEST);
        assertRegistryError(() -> service.checkEligibility(ALICE, -1L), RegistryError.INVALID_AMOUNT);

        assertThat(accountStore.find(ALICE).orElseThrow().getDailySpent()).isZero();
    }

    @Test
    @DisplayName("0 금액 거래는 적격성 판단과 같은 결과를 낸다")
    void zeroAmountTransactionFollowsEligibility() {
        // given
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);
        assertThat(service.checkEligibility(ALICE, 0L).status()).isEqualTo(EligibilityStatus.ELIGIBLE);

        // when
        ComplianceRecord afterZero = service.recordTransaction(ALICE, 0L, "platform-a");
        ComplianceRecord afterSixty = service.recordTransaction(ALICE, 60L, "platform-b");

        // then: 합계는 0 + 60, 플랫폼은 둘 다 기록된다
        assertThat(afterZero.getDailySpent()).isZero();
        assertThat(afterSixty.getDailySpent()).isEqualTo(60L);
        assertThat(afterSixty.getMonthlySpent()).isEqualTo(60L);
        assertThat(afterSixty.getPlatformsUsed()).containsExactlyInAnyOrder("platform-a", "platform-b");

        // 미등록 계정은 0 금액이어도 NOT_REGISTERED
        assertRegistryError(() -> service.recordTransaction(BOB, 0L, "platform-a"), RegistryError.NOT_REGISTERED);
    }

    @Test
    @DisplayName("이벤트 기록이 실패하면 같은 트랜잭션의 거래도 남지 않는다")
    void failedEventWriteShouldDiscardTransaction() {
        // given
        ComplianceRegistryService transactional = service(new SynchronizedTransactionOperations());
        transactional.registerUser(ALICE, attestor.sign(ALICE));
        transactional.setLimits(ALICE, 100L, 1_000L);
        doThrow(new IllegalStateException("outbox unavailable"))
            .when(eventPublisher).publish(eq(ALICE), eq("TransactionRecorded"), any());

        // when
        assertThatThrownBy(() -> transactional.recordTransaction(ALICE, 60L, "platform-a"))
            .isInstanceOf(IllegalStateException.class);

        // then
        ComplianceRecord stored = accountStore.find(ALICE).orElseThrow();
        assertThat(stored.getDailySpent()).isZero();
        assertThat(stored.getPlatformsUsed()).isEmpty();
    }

    @Test
    @DisplayName("미등록 계정 거래는 NOT_REGISTERED이다")
    void transactionForUnknownAccountShouldFail() {
        assertRegistryError(() -> service.recordTransaction(BOB, 10L, "platform-a"), RegistryError.NOT_REGISTERED);
        assertThat(service.checkEligibility(BOB, 0L).status()).isEqualTo(EligibilityStatus.NOT_REGISTERED);
    }

    @Test
    @DisplayName("self-exclusion 중 재요청은 ALREADY_EXCLUDED이고 만료 후에는 다시 걸 수 있다")
    void selfExclusionCannotBeShortenedWhileActive() {
        register(ALICE);
        ComplianceRecord excluded = service.selfExclude(ALICE, 30);
        Instant until = excluded.getSelfExcludedUntil();
        assertThat(until).isEqualTo(START.plus(Duration.ofDays(30)));

        assertRegistryError(() -> service.selfExclude(ALICE, 1), RegistryError.ALREADY_EXCLUDED);
        assertThat(accountStore.find(ALICE).orElseThrow().getSelfExcludedUntil()).isEqualTo(until);

        // when: 만료 시각에 도달한다
        clock.set(until);

        // then
        assertThat(service.checkEligibility(ALICE, 0L).status()).isNotEqualTo(EligibilityStatus.SELF_EXCLUDED);
        assertThat(service.selfExclude(ALICE, 7).getSelfExcludedUntil()).isEqualTo(until.plus(Duration.ofDays(7)));
    }

    @Test
    @DisplayName("self-exclusion 기간은 1일 이상 최대값 이하여야 한다")
    void selfExclusionDurationShouldBeBounded() {
        register(ALICE);

        assertRegistryError(() -> service.selfExclude(ALICE, 0), RegistryError.INVALID_DURATION);
        assertRegistryError(() -> service.selfExclude(ALICE, 3_651), RegistryError.INVALID_DURATION);
        assertRegistryError(() -> service.selfExclude(BOB, 5), RegistryError.NOT_REGISTERED);
    }

    @Test
    @DisplayName("쿨다운은 연장할 수 있지만 단축할 수 없다")
    void cooldownCanBeExtendedButNotShortened() {
        register(ALICE);
        service.setLimits(ALICE, 100L, 1_000L);
        service.startCooldown(ALICE, 24);
        assertRegistryError(() -> service.recordTransaction(ALICE, 10L, "platform-a"), RegistryError.ON_COOLDOWN);

        assertRegistryError(() -> service.startCooldown(ALICE, 1), RegistryError.COOLDOWN_ACTIVE);

        ComplianceRecord extended = service.startCooldown(ALICE, 48);
        assertThat(extended.getCooldownUntil()).isEqualTo(START.plus(Duration.ofHours(48)));

        clock.advance(Duration.ofHours(48));
        assertThat(service.recordTransaction(ALICE, 10L, "platform-a").getDailySpent()).isEqualTo(10L);
    }

    @Test
    @DisplayName("잘못된 accountId는 INVALID_REQUEST이다")
    void blankAccountIdShouldBeRejected() {
        assertRegistryError(() -> service.getRecord(" "), RegistryError.INVALID_REQUEST);
        assertRegistryError(() -> service.checkEligibility("x".repeat(129), 1L), RegistryError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("네트워크 prefix가 없는 주소에 대한 서명도 prefix를 제거한 값 기준으로 검증한다")
    void accountWithoutPrefixShouldVerifyAgainstWholeId() {
        assertThat(CHARLIE).doesNotStartWith("3");

        ComplianceRecord record = service.registerUser(CHARLIE, attestor.sign(CHARLIE));

        assertThat(record.getAccountId()).isEqualTo(CHARLIE);
    }

    private ComplianceRecord register(String accountId) {
        return service.registerUser(accountId, attestor.sign(accountId));
    }

    private static void assertRegistryError(Runnable call, RegistryError expected) {
        assertThatThrownBy(call::run)
            .isInstanceOfSatisfying(RegistryException.class, ex -> {
                assertThat(ex.getError()).isEqualTo(expected);
                assertThat(ex.getStatus()).isEqualTo(expected.getStatus());
            });
    }
}
