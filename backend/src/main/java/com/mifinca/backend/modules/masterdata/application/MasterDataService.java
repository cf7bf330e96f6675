package com.mifinca.backend.modules.masterdata.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;
import com.mifinca.backend.modules.masterdata.infrastructure.persistence.MasterDataRepository;
import com.mifinca.backend.modules.masterdata.presentation.dto.MasterDataRequest;
import com.mifinca.backend.modules.masterdata.presentation.dto.MasterDataResponse;
import com.mifinca.backend.modules.rbac.application.PermissionEvaluator;
import com.mifinca.backend.modules.rbac.application.PermissionNames;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class MasterDataService {

    private static final Logger log = LoggerFactory.getLogger(MasterDataService.class);

    private final MasterDataRepository masterDataRepository;
    private final CurrentActorService currentActorService;
    private final PermissionEvaluator permissionEvaluator;

    public MasterDataService(
            MasterDataRepository masterDataRepository,
            CurrentActorService currentActorService,
            PermissionEvaluator permissionEvaluator
    ) {
        this.masterDataRepository = masterDataRepository;
        this.currentActorService = currentActorService;
        this.permissionEvaluator = permissionEvaluator;
    }

    @Transactional(readOnly = true)
    public List<MasterDataResponse> list(MasterDataCategory category) {
        currentActorService.requireActor();
        List<MasterData> rows = category != null
                ? masterDataRepository.findByCategoryOrderByNameAsc(category)
                : masterDataRepository.findAllByOrderByCategoryAscNameAsc();
        return rows.stream().map(MasterDataResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public MasterDataResponse get(UUID masterDataId) {
        currentActorService.requireActor();
        return MasterDataResponse.from(load(masterDataId));
    }

    public MasterDataResponse create(MasterDataRequest request) {
        requireManage(currentActorService.requireActor());
        String name = request.name().trim();
        if (masterDataRepository.existsByCategoryAndNameIgnoreCase(request.category(), name)) {
            throw ProblemException.alreadyExists("MASTER_DATA_ALREADY_EXISTS");
        }
        MasterData masterData = new MasterData();
        masterData.setCategory(request.category());
        masterData.setName(name);
        masterData.setDescription(request.description());
        masterData.setActive(request.active() == null || request.active());
        return MasterDataResponse.from(saveUnique(masterData));
    }

    public MasterDataResponse update(UUID masterDataId, MasterDataRequest request) {
        Actor actor = currentActorService.requireActor();
        MasterData masterData = load(masterDataId);
        requireManage(actor);

        String name = request.name().trim();
        boolean renamed = request.category() != masterData.getCategory() || !name.equalsIgnoreCase(masterData.getName());
        if (renamed && masterDataRepository.existsByCategoryAndNameIgnoreCase(request.category(), name)) {
            throw ProblemException.alreadyExists("MASTER_DATA_ALREADY_EXISTS");
        }
        masterData.setCategory(request.category());
        masterData.setName(name);
        masterData.setDescription(request.description());
        if (request.active() != null) {
            masterData.setActive(request.active());
        }
        return MasterDataResponse.from(saveUnique(masterData));
    }

    public void delete(UUID masterDataId) {
        Actor actor = currentActorService.requireActor();
        MasterData masterData = load(masterDataId);
        requireManage(actor);

        try {
            masterDataRepository.delete(masterData);
            masterDataRepository.flush();
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.INTEGRITY_VIOLATION, "MASTER_DATA_IN_USE", null, ex);
        }
        log.info("Master data {} ({}) deleted by {}", masterDataId, masterData.getCategory(), actor.userId());
    }

    private void requireManage(Actor actor) {
        if (!permissionEvaluator.hasPermission(actor, PermissionNames.MASTER_DATA_MANAGE)) {
            throw ProblemException.forbidden();
        }
    }

    private MasterData load(UUID masterDataId) {
        return masterDataRepository.findById(masterDataId)
                .orElseThrow(() -> ProblemException.notFound("MASTER_DATA_NOT_FOUND"));
    }

    private MasterData saveUnique(MasterData masterData) {
        try {
            return masterDataRepository.saveAndFlush(masterData);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "MASTER_DATA_ALREADY_EXISTS", null, ex);
        }
    }
}
