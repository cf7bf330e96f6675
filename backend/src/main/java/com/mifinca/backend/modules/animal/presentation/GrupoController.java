package com.mifinca.backend.modules.animal.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.animal.application.GrupoService;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoMemberRequest;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoMemberResponse;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoRequest;
import com.mifinca.backend.modules.animal.presentation.dto.GrupoResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/grupos")
public class GrupoController {

    private final GrupoService grupoService;

    public GrupoController(GrupoService grupoService) {
        this.grupoService = grupoService;
    }

    @PostMapping
    public ResponseEntity<GrupoResponse> createGrupo(@Valid @RequestBody GrupoRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(grupoService.createGrupo(request));
    }

    @GetMapping
    public ResponseEntity<List<GrupoResponse>> listGrupos() {
        return ResponseEntity.ok(grupoService.listGrupos());
    }

    @GetMapping("/{grupoId}")
    public ResponseEntity<GrupoResponse> getGrupo(@PathVariable("grupoId") UUID grupoId) {
        return ResponseEntity.ok(grupoService.getGrupo(grupoId));
    }

    @PutMapping("/{grupoId}")
    public ResponseEntity<GrupoResponse> updateGrupo(
            @PathVariable("grupoId") UUID grupoId,
            @Valid @RequestBody GrupoRequest request
    ) {
        return ResponseEntity.ok(grupoService.updateGrupo(grupoId, request));
    }

    @DeleteMapping("/{grupoId}")
    public ResponseEntity<Void> deleteGrupo(@PathVariable("grupoId") UUID grupoId) {
        grupoService.deleteGrupo(grupoId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{grupoId}/animals")
    public ResponseEntity<GrupoMemberResponse> addAnimal(
            @PathVariable("grupoId") UUID grupoId,
            @Valid @RequestBody GrupoMemberRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(grupoService.addAnimal(grupoId, request));
    }

    @GetMapping("/{grupoId}/animals")
    public ResponseEntity<List<GrupoMemberResponse>> listMembers(@PathVariable("grupoId") UUID grupoId) {
        return ResponseEntity.ok(grupoService.listMembers(grupoId));
    }

    @DeleteMapping("/{grupoId}/animals/{membershipId}")
    public ResponseEntity<GrupoMemberResponse> removeAnimal(
            @PathVariable("grupoId") UUID grupoId,
            @PathVariable("membershipId") UUID membershipId
    ) {
        return ResponseEntity.ok(grupoService.removeAnimal(grupoId, membershipId));
    }
}
