package com.mifinca.backend.modules.event.application;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.mifinca.backend.modules.event.domain.Transaction;
import com.mifinca.backend.modules.event.domain.TransactionSubject;
import com.mifinca.backend.modules.event.infrastructure.persistence.BatchRepository;
import com.mifinca.backend.modules.event.infrastructure.persistence.TransactionRepository;
import com.mifinca.backend.modules.event.presentation.dto.TransactionRequest;
import com.mifinca.backend.modules.event.presentation.dto.TransactionResponse;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.ProductRepository;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Transfers of an animal, a product or a batch. The sender is always the caller and stays fixed
 * for the life of the record.
 */
@Service
@Transactional
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final TransactionRepository transactionRepository;
    private final AnimalRepository animalRepository;
    private final ProductRepository productRepository;
    private final BatchRepository batchRepository;
    private final FarmRepository farmRepository;
    private final AppUserRepository appUserRepository;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public TransactionService(
            TransactionRepository transactionRepository,
            AnimalRepository animalRepository,
            ProductRepository productRepository,
            BatchRepository batchRepository,
            FarmRepository farmRepository,
            AppUserRepository appUserRepository,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.transactionRepository = transactionRepository;
        this.animalRepository = animalRepository;
        this.productRepository = productRepository;
        this.batchRepository = batchRepository;
        this.farmRepository = farmRepository;
        this.appUserRepository = appUserRepository;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    public TransactionResponse createTransaction(TransactionRequest request) {
        Actor actor = currentActorService.requireActor();
        TransactionReferences refs = resolveReferences(request);
        if (request.fromOwnerUserId() != null && !actor.is(request.fromOwnerUserId())) {
            log.debug("User {} tried to record a transaction on behalf of {}", actor.userId(), request.fromOwnerUserId());
            throw ProblemException.forbidden();
        }
        requireSenderFarm(actor, refs.fromFarm());

        Transaction transaction = new Transaction();
        transaction.setFromOwner(currentActorService.reference(actor));
        apply(transaction, request, refs);
        return TransactionResponse.from(transactionRepository.save(transaction));
    }

    @Transactional(readOnly = true)
    public TransactionResponse getTransaction(UUID transactionId) {
        Actor actor = currentActorService.requireActor();
        Transaction transaction = loadTransaction(transactionId);
        accessGuard.requireTransaction(actor, transaction, AccessOperation.READ);
        return TransactionResponse.from(transaction);
    }

    @Transactional(readOnly = true)
    public List<TransactionResponse> listTransactions() {
        Actor actor = currentActorService.requireActor();
        List<Transaction> transactions = actor.superuser()
                ? transactionRepository.findAll(Sort.by(Sort.Direction.DESC, "transactionDate"))
                : transactionRepository.findInvolving(actor.userId());
        return transactions.stream().map(TransactionResponse::from).toList();
    }

    public TransactionResponse updateTransaction(UUID transactionId, TransactionRequest request) {
        Actor actor = currentActorService.requireActor();
        Transaction transaction = loadTransaction(transactionId);
        if (request.fromOwnerUserId() != null && !request.fromOwnerUserId().equals(transaction.getFromOwnerId())) {
            throw ProblemException.invalid("IMMUTABLE_FIELD", "fromOwnerUserId cannot be changed");
        }
        TransactionReferences refs = resolveReferences(request);
        accessGuard.requireTransaction(actor, transaction, AccessOperation.WRITE);
        UUID currentFromFarmId = transaction.getFromFarm() != null ? transaction.getFromFarm().getId() : null;
        if (refs.fromFarm() != null && !refs.fromFarm().getId().equals(currentFromFarmId)) {
            requireSenderFarm(actor, refs.fromFarm());
        }

        apply(transaction, request, refs);
        return TransactionResponse.from(transactionRepository.save(transaction));
    }

    public void deleteTransaction(UUID transactionId) {
        Actor actor = currentActorService.requireActor();
        Transaction transaction = loadTransaction(transactionId);
        accessGuard.requireTransaction(actor, transaction, AccessOperation.DELETE);
        transactionRepository.delete(transaction);
    }

    private void requireSenderFarm(Actor actor, Farm fromFarm) {
        if (fromFarm != null) {
            accessGuard.requireFarm(actor, fromFarm, AccessOperation.WRITE);
        }
    }

    private TransactionReferences resolveReferences(TransactionRequest request) {
        TransactionSubject subject = TransactionSubject.of(request.subjectKind(), request.subjectId());
        requireSubject(subject);
        return new TransactionReferences(
                subject,
                masterDataLookup.requireCategory(request.transactionTypeId(), MasterDataCategory.TRANSACTION_TYPE),
                masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT),
                optionalFarm(request.fromFarmId()),
                optionalFarm(request.toFarmId()),
                optionalUser(request.toOwnerUserId())
        );
    }

    private void requireSubject(TransactionSubject subject) {
        boolean exists = switch (subject.kind()) {
            case ANIMAL -> animalRepository.existsById(subject.id());
            case PRODUCT -> productRepository.existsById(subject.id());
            case BATCH -> batchRepository.existsById(subject.id());
        };
        if (!exists) {
            throw ProblemException.notFound(subject.kind().name() + "_NOT_FOUND");
        }
    }

    private void apply(Transaction transaction, TransactionRequest request, TransactionReferences refs) {
        transaction.setSubject(refs.subject());
        transaction.setTransactionType(refs.transactionType());
        transaction.setTransactionDate(request.transactionDate());
        transaction.setToOwner(refs.toOwner());
        transaction.setFromFarm(refs.fromFarm());
        transaction.setToFarm(refs.toFarm());
        transaction.setQuantity(request.quantity());
        transaction.setUnit(refs.unit());
        transaction.setPricePerUnit(request.pricePerUnit());
        transaction.setTotalAmount(totalAmount(request));
        transaction.setNotes(request.notes());
    }

    static BigDecimal totalAmount(TransactionRequest request) {
        if (request.totalAmount() != null) {
            return request.totalAmount();
        }
        if (request.quantity() != null && request.pricePerUnit() != null) {
            return request.quantity().multiply(request.pricePerUnit());
        }
        return null;
    }

    private record TransactionReferences(
            TransactionSubject subject,
            MasterData transactionType,
            MasterData unit,
            Farm fromFarm,
            Farm toFarm,
            AppUser toOwner
    ) {
    }

    private Farm optionalFarm(UUID farmId) {
        if (farmId == null) {
            return null;
        }
        return farmRepository.findById(farmId)
                .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
    }

    private AppUser optionalUser(UUID userId) {
        if (userId == null) {
            return null;
        }
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }

    private Transaction loadTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> ProblemException.notFound("TRANSACTION_NOT_FOUND"));
    }
}
