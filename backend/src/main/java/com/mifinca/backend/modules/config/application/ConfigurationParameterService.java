package com.mifinca.backend.modules.config.application;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.config.domain.ConfigurationParameter;
import com.mifinca.backend.modules.config.infrastructure.persistence.ConfigurationParameterRepository;
import com.mifinca.backend.modules.config.presentation.dto.ConfigurationParameterRequest;
import com.mifinca.backend.modules.config.presentation.dto.ConfigurationParameterResponse;
import com.mifinca.backend.modules.config.presentation.dto.UpdateConfigurationParameterRequest;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * System-wide settings. Every active user reads them; only superusers change them.
 */
@Service
@Transactional
public class ConfigurationParameterService {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationParameterService.class);

    private final ConfigurationParameterRepository parameterRepository;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public ConfigurationParameterService(
            ConfigurationParameterRepository parameterRepository,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.parameterRepository = parameterRepository;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public List<ConfigurationParameterResponse> list() {
        currentActorService.requireActor();
        return parameterRepository.findAllByOrderByNameAsc().stream()
                .map(ConfigurationParameterResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public ConfigurationParameterResponse get(UUID parameterId) {
        currentActorService.requireActor();
        return ConfigurationParameterResponse.from(load(parameterId));
    }

    @Transactional(readOnly = true)
    public ConfigurationParameterResponse getByName(String name) {
        currentActorService.requireActor();
        return parameterRepository.findByNameIgnoreCase(name.trim())
                .map(ConfigurationParameterResponse::from)
                .orElseThrow(() -> ProblemException.notFound("CONFIGURATION_PARAMETER_NOT_FOUND"));
    }

    public ConfigurationParameterResponse create(ConfigurationParameterRequest request) {
        Actor actor = currentActorService.requireActor();
        accessGuard.requireSuperuser(actor, ResourcePolicy.CONFIGURATION_PARAMETER, AccessOperation.WRITE);
        String name = request.name().trim();
        if (parameterRepository.existsByNameIgnoreCase(name)) {
            throw ProblemException.alreadyExists("CONFIGURATION_PARAMETER_ALREADY_EXISTS");
        }
        ConfigurationParameter parameter = new ConfigurationParameter();
        parameter.setName(name);
        parameter.setValue(request.value());
        parameter.setDescription(request.description());
        parameter.setDataType(masterDataLookup.requireCategory(request.dataTypeId(), MasterDataCategory.DATA_TYPE));
        parameter.setActive(request.active() == null || request.active());
        parameter.setCreatedBy(currentActorService.reference(actor));

        ConfigurationParameter saved = saveUnique(() -> parameterRepository.saveAndFlush(parameter));
        log.info("Configuration parameter {} created by {}", saved.getName(), actor.userId());
        return ConfigurationParameterResponse.from(saved);
    }

    public ConfigurationParameterResponse update(UUID parameterId, UpdateConfigurationParameterRequest request) {
        Actor actor = currentActorService.requireActor();
        ConfigurationParameter parameter = load(parameterId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.CONFIGURATION_PARAMETER, AccessOperation.WRITE);

        if (request.name() != null) {
            String name = request.name().trim();
            if (!name.equalsIgnoreCase(parameter.getName()) && parameterRepository.existsByNameIgnoreCase(name)) {
                throw ProblemException.alreadyExists("CONFIGURATION_PARAMETER_ALREADY_EXISTS");
            }
            parameter.setName(name);
        }
        if (request.value() != null) {
            parameter.setValue(request.value());
        }
        if (request.description() != null) {
            parameter.setDescription(request.description());
        }
        if (request.dataTypeId() != null) {
            parameter.setDataType(masterDataLookup.requireCategory(request.dataTypeId(), MasterDataCategory.DATA_TYPE));
        }
        if (request.active() != null) {
            parameter.setActive(request.active());
        }

        ConfigurationParameter saved = saveUnique(() -> parameterRepository.saveAndFlush(parameter));
        log.info("Configuration parameter {} updated by {}", parameterId, actor.userId());
        return ConfigurationParameterResponse.from(saved);
    }

    public void delete(UUID parameterId) {
        Actor actor = currentActorService.requireActor();
        ConfigurationParameter parameter = load(parameterId);
        accessGuard.requireSuperuser(actor, ResourcePolicy.CONFIGURATION_PARAMETER, AccessOperation.DELETE);

        parameterRepository.delete(parameter);
        log.info("Configuration parameter {} deleted by {}", parameterId, actor.userId());
    }

    private ConfigurationParameter load(UUID parameterId) {
        return parameterRepository.findById(parameterId)
                .orElseThrow(() -> ProblemException.notFound("CONFIGURATION_PARAMETER_NOT_FOUND"));
    }

    private ConfigurationParameter saveUnique(Supplier<ConfigurationParameter> save) {
        try {
            return save.get();
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "CONFIGURATION_PARAMETER_ALREADY_EXISTS", null, ex);
        }
    }
}
