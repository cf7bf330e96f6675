package com.mifinca.backend.modules.animal.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.AnimalGroup;
import com.mifinca.backend.modules.animal.domain.Grupo;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalGroupRepository;
import com.mifinca.backend.modules.animal.infrastructure.persistence.AnimalRepository;
import com.mifinca.backend.modules.animal.infrastructure.persistence.GrupoRepository;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoMemberRequest;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoMemberResponse;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoRequest;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoResponse;
import com.mifinca.backend.modules.auth.application.CurrentActorService;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grupos are private to their creator. Farm grants never extend to them, even when the grantee can
 * see every animal inside.
 */
@Service
@Transactional
public class GrupoService {

    private final GrupoRepository grupoRepository;
    private final AnimalGroupRepository animalGroupRepository;
    private final AnimalRepository animalRepository;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;
    private final Clock clock;

    public GrupoService(
            GrupoRepository grupoRepository,
            AnimalGroupRepository animalGroupRepository,
            AnimalRepository animalRepository,
            CurrentActorService currentActorService,
            AccessGuard accessGuard,
            Clock clock
    ) {
        this.grupoRepository = grupoRepository;
        this.animalGroupRepository = animalGroupRepository;
        this.animalRepository = animalRepository;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
        this.clock = clock;
    }

    public GrupoResponse createGrupo(GrupoRequest request) {
        Actor actor = currentActorService.requireActor();
        String name = request.name().trim();
        if (grupoRepository.existsByNameIgnoreCaseAndCreatedBy_Id(name, actor.userId())) {
            throw ProblemException.alreadyExists("GRUPO_ALREADY_EXISTS");
        }
        Grupo grupo = new Grupo();
        grupo.setCreatedBy(currentActorService.reference(actor));
        grupo.setName(name);
        grupo.setDescription(request.description());
        return GrupoResponse.from(saveGrupo(grupo));
    }

    @Transactional(readOnly = true)
    public GrupoResponse getGrupo(UUID grupoId) {
        Actor actor = currentActorService.requireActor();
        Grupo grupo = loadGrupo(grupoId);
        accessGuard.requireGrupo(actor, grupo, AccessOperation.READ);
        return GrupoResponse.from(grupo);
    }

    @Transactional(readOnly = true)
    public List<GrupoResponse> listGrupos() {
        Actor actor = currentActorService.requireActor();
        return grupoRepository.findByCreatedBy_IdOrderByNameAsc(actor.userId()).stream()
                .map(GrupoResponse::from)
                .toList();
    }

    public GrupoResponse updateGrupo(UUID grupoId, GrupoRequest request) {
        Actor actor = currentActorService.requireActor();
        Grupo grupo = loadGrupo(grupoId);
        accessGuard.requireGrupo(actor, grupo, AccessOperation.WRITE);

        String name = request.name().trim();
        if (!name.equalsIgnoreCase(grupo.getName())
                && grupoRepository.existsByNameIgnoreCaseAndCreatedBy_Id(name, grupo.getCreatedById())) {
            throw ProblemException.alreadyExists("GRUPO_ALREADY_EXISTS");
        }
        grupo.setName(name);
        grupo.setDescription(request.description());
        return GrupoResponse.from(saveGrupo(grupo));
    }

    public void deleteGrupo(UUID grupoId) {
        Actor actor = currentActorService.requireActor();
        Grupo grupo = loadGrupo(grupoId);
        accessGuard.requireGrupo(actor, grupo, AccessOperation.DELETE);
        grupoRepository.delete(grupo);
    }

    /**
     * Adding an animal also needs write access to the animal itself.
     */
    public GrupoMemberResponse addAnimal(UUID grupoId, GrupoMemberRequest request) {
        Actor actor = currentActorService.requireActor();
        Grupo grupo = loadGrupo(grupoId);
        Animal animal = animalRepository.findById(request.animalId())
                .orElseThrow(() -> ProblemException.notFound("ANIMAL_NOT_FOUND"));
        accessGuard.requireGrupo(actor, grupo, AccessOperation.WRITE);
        accessGuard.requireAnimal(actor, animal, AccessOperation.WRITE);

        if (animalGroupRepository.existsByGrupo_IdAndAnimal_IdAndRemovedAtIsNull(grupoId, animal.getId())) {
            throw ProblemException.alreadyExists("ANIMAL_ALREADY_IN_GRUPO");
        }
        AnimalGroup membership = new AnimalGroup();
        membership.setGrupo(grupo);
        membership.setAnimal(animal);
        membership.setAssignedAt(OffsetDateTime.now(clock));
        membership.setNotes(request.notes());
        try {
            return GrupoMemberResponse.from(animalGroupRepository.saveAndFlush(membership));
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "ANIMAL_ALREADY_IN_GRUPO", null, ex);
        }
    }

    @Transactional(readOnly = true)
    public List<GrupoMemberResponse> listMembers(UUID grupoId) {
        Actor actor = currentActorService.requireActor();
        Grupo grupo = loadGrupo(grupoId);
        accessGuard.requireGrupo(actor, grupo, AccessOperation.READ);
        return animalGroupRepository.findByGrupo_IdOrderByAssignedAtAsc(grupoId).stream()
                .map(GrupoMemberResponse::from)
                .toList();
    }

    /**
     * Closes the membership; the row stays as history.
     */
    public GrupoMemberResponse removeAnimal(UUID grupoId, UUID membershipId) {
        Actor actor = currentActorService.requireActor();
        Grupo grupo = loadGrupo(grupoId);
        AnimalGroup membership = animalGroupRepository.findById(membershipId)
                .filter(found -> found.getGrupo().getId().equals(grupoId))
                .filter(AnimalGroup::isActive)
                .orElseThrow(() -> ProblemException.notFound("GRUPO_MEMBERSHIP_NOT_FOUND"));
        accessGuard.requireGrupo(actor, grupo, AccessOperation.WRITE);

        membership.setRemovedAt(OffsetDateTime.now(clock));
        return GrupoMemberResponse.from(animalGroupRepository.save(membership));
    }

    private Grupo saveGrupo(Grupo grupo) {
        try {
            return grupoRepository.saveAndFlush(grupo);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(ProblemCategory.ALREADY_EXISTS, "GRUPO_ALREADY_EXISTS", null, ex);
        }
    }

    private Grupo loadGrupo(UUID grupoId) {
        return grupoRepository.findById(grupoId)
                .orElseThrow(() -> ProblemException.notFound("GRUPO_NOT_FOUND"));
    }
}
