package com.mifinca.backend.modules.event.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.event.domain.Transaction;
import com.mifinca.backend.modules.event.domain.TransactionSubject;
import com.mifinca.backend.modules.event.domain.TransactionSubjectKind;
import com.mifinca.backend.modules.event.infrastructure.persistence.BatchRepository;
import com.mifinca.backend.modules.event.infrastructure.persistence.TransactionRepository;
import com.mifinca.backend.modules.event.presentation.dto.TransactionRequest;
import com.mifinca.backend.modules.event.presentation.dto.TransactionResponse;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.ProductRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;
import com.mifinca.backend.support.Fixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransactionServiceTest {

    private static final OffsetDateTime WHEN = OffsetDateTime.parse("2025-04-10T09:30:00Z");

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private AnimalRepository animalRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private BatchRepository batchRepository;

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private MasterDataLookup masterDataLookup;

    @Mock
    private CurrentActorService currentActorService;

    private TransactionService service;

    private AppUser seller;
    private AppUser buyer;
    private MasterData sale;
    private UUID animalId;

    @BeforeEach
    void setUp() {
        AccessGuard guard = new AccessGuard(
                new OwnershipResolver(farmRepository, userFarmAccessRepository),
                new AccessDecisionEngine()
        );
        service = new TransactionService(
                transactionRepository,
                animalRepository,
                productRepository,
                batchRepository,
                farmRepository,
                appUserRepository,
                masterDataLookup,
                currentActorService,
                guard
        );
        seller = Fixtures.user("seller@finca.test");
        buyer = Fixtures.user("buyer@finca.test");
        sale = new MasterData();
        sale.setCategory(MasterDataCategory.TRANSACTION_TYPE);
        sale.setName("Venta");
        Fixtures.withId(sale, UUID.randomUUID());
        animalId = UUID.randomUUID();
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    private TransactionRequest saleOf(UUID fromOwner, UUID fromFarm, BigDecimal quantity, BigDecimal price, BigDecimal total) {
        return new TransactionRequest(
                sale.getId(), WHEN, TransactionSubjectKind.ANIMAL, animalId,
                fromOwner, buyer.getId(), fromFarm, null,
                quantity, null, price, total, null
        );
    }

    private void subjectAndReferencesResolve() {
        when(animalRepository.existsById(animalId)).thenReturn(true);
        when(masterDataLookup.requireCategory(sale.getId(), MasterDataCategory.TRANSACTION_TYPE)).thenReturn(sale);
        when(appUserRepository.findById(buyer.getId())).thenReturn(Optional.of(buyer));
    }

    private Transaction existingSale() {
        Transaction transaction = new Transaction();
        transaction.setSubject(TransactionSubject.of(TransactionSubjectKind.ANIMAL, animalId));
        transaction.setTransactionType(sale);
        transaction.setTransactionDate(WHEN);
        transaction.setFromOwner(seller);
        transaction.setToOwner(buyer);
        return Fixtures.withId(transaction, UUID.randomUUID());
    }

    @Test
    @DisplayName("the caller becomes the sender and the total is derived from quantity and price")
    void createDerivesSenderAndTotal() {
        actingAs(seller);
        subjectAndReferencesResolve();
        when(currentActorService.reference(any(Actor.class))).thenReturn(seller);
        when(transactionRepository.save(any(Transaction.class)))
                .thenAnswer(inv -> Fixtures.withId(inv.getArgument(0), UUID.randomUUID()));

        TransactionResponse response = service.createTransaction(
                saleOf(null, null, new BigDecimal("2"), new BigDecimal("1500000.50"), null));

        assertThat(response.fromOwnerUserId()).isEqualTo(seller.getId());
        assertThat(response.toOwnerUserId()).isEqualTo(buyer.getId());
        assertThat(response.totalAmount()).isEqualByComparingTo("3000001.00");
        assertThat(response.subjectKind()).isEqualTo(TransactionSubjectKind.ANIMAL);
    }

    @Test
    @DisplayName("recording a transaction on behalf of someone else is forbidden")
    void createOnBehalfOfOther() {
        actingAs(buyer);
        subjectAndReferencesResolve();

        assertThatThrownBy(() -> service.createTransaction(saleOf(seller.getId(), null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
        verify(transactionRepository, never()).save(any());
    }

    @Test
    @DisplayName("the source farm must be one the sender owns")
    void createFromForeignFarm() {
        Farm foreign = Fixtures.farm("Ajena", buyer);
        actingAs(seller);
        subjectAndReferencesResolve();
        when(farmRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> service.createTransaction(saleOf(null, foreign.getId(), null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
    }

    @Test
    @DisplayName("a missing subject is reported as not-found for its kind")
    void missingSubject() {
        actingAs(seller);
        when(animalRepository.existsById(animalId)).thenReturn(false);

        assertThatThrownBy(() -> service.createTransaction(saleOf(null, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("ANIMAL_NOT_FOUND");
    }

    @Test
    @DisplayName("the receiver reads the transaction but cannot change it")
    void receiverReadsOnly() {
        Transaction transaction = existingSale();
        actingAs(buyer);
        when(transactionRepository.findById(transaction.getId())).thenReturn(Optional.of(transaction));

        assertThat(service.getTransaction(transaction.getId()).fromOwnerUserId()).isEqualTo(seller.getId());

        subjectAndReferencesResolve();
        assertThatThrownBy(() -> service.updateTransaction(transaction.getId(), saleOf(null, null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCategory())
                .isEqualTo(ProblemCategory.FORBIDDEN);
    }

    @Test
    @DisplayName("the sender of a recorded transaction cannot be changed")
    void senderIsImmutable() {
        Transaction transaction = existingSale();
        actingAs(seller);
        when(transactionRepository.findById(transaction.getId())).thenReturn(Optional.of(transaction));

        assertThatThrownBy(() -> service.updateTransaction(transaction.getId(), saleOf(buyer.getId(), null, null, null, null)))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("IMMUTABLE_FIELD");
    }

    @Test
    @DisplayName("an explicit total wins over quantity times price")
    void explicitTotalWins() {
        TransactionRequest request = saleOf(null, null, new BigDecimal("3"), new BigDecimal("10"), new BigDecimal("25"));

        assertThat(TransactionService.totalAmount(request)).isEqualByComparingTo("25");
        assertThat(TransactionService.totalAmount(saleOf(null, null, new BigDecimal("3"), null, null))).isNull();
    }
}
