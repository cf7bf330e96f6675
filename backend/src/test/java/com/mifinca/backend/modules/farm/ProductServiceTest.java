package com.mifinca.backend.modules.farm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemCategory;
import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessDecisionEngine;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.application.OwnershipResolver;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.application.ProductService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Product;
import com.mifinca.backend.modules.farm.domain.UserFarmAccessId;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.ProductRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.UserFarmAccessRepository;
import com.mifinca.backend.modules.farm.presentation.dto.ProductRequest;
import com.mifinca.backend.modules.farm.presentation.dto.ProductResponse;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.support.Fixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProductServiceTest {

    @Mock
    private ProductRepository productRepository;

    @Mock
    private FarmRepository farmRepository;

    @Mock
    private UserFarmAccessRepository userFarmAccessRepository;

    @Mock
    private MasterDataLookup masterDataLookup;

    @Mock
    private CurrentActorService currentActorService;

    private ProductService service;
    private AppUser ownerA;
    private AppUser workerB;
    private Farm farm;
    private Product vaccine;

    @BeforeEach
    void setUp() {
        OwnershipResolver resolver = new OwnershipResolver(farmRepository, userFarmAccessRepository);
        service = new ProductService(
                productRepository,
                farmRepository,
                masterDataLookup,
                currentActorService,
                new AccessGuard(resolver, new AccessDecisionEngine())
        );
        ownerA = Fixtures.user("a@finca.test");
        workerB = Fixtures.user("b@finca.test");
        farm = Fixtures.farm("La Pradera", ownerA);

        vaccine = new Product();
        vaccine.setName("Aftosa");
        vaccine.setFarm(farm);
        vaccine.setQuantity(new BigDecimal("40"));
        Fixtures.withId(vaccine, UUID.randomUUID());
    }

    private void actingAs(AppUser user) {
        when(currentActorService.requireActor()).thenReturn(Fixtures.actor(user));
    }

    private void grantWorker() {
        when(userFarmAccessRepository.existsById(new UserFarmAccessId(workerB.getId(), farm.getId()))).thenReturn(true);
    }

    @Test
    @DisplayName("the farm owner stocks a product")
    void ownerCreatesProduct() {
        actingAs(ownerA);
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));
        when(productRepository.save(any(Product.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ProductResponse response = service.createProduct(
                new ProductRequest("  Ivermectina ", farm.getId(), null, null, new BigDecimal("12"), null));

        assertThat(response.name()).isEqualTo("Ivermectina");
        assertThat(response.farmId()).isEqualTo(farm.getId());
    }

    @Test
    @DisplayName("a grantee lists and reads the farm's products")
    void granteeReads() {
        actingAs(workerB);
        grantWorker();
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));
        when(productRepository.findByFarm_IdOrderByNameAsc(farm.getId())).thenReturn(List.of(vaccine));
        when(productRepository.findById(vaccine.getId())).thenReturn(Optional.of(vaccine));

        assertThat(service.listProducts(farm.getId())).extracting(ProductResponse::productId)
                .containsExactly(vaccine.getId());
        assertThat(service.getProduct(vaccine.getId()).name()).isEqualTo("Aftosa");
    }

    @Test
    @DisplayName("a grantee can neither stock, change nor remove products")
    void granteeCannotWrite() {
        actingAs(workerB);
        grantWorker();
        when(farmRepository.findById(farm.getId())).thenReturn(Optional.of(farm));
        when(productRepository.findById(vaccine.getId())).thenReturn(Optional.of(vaccine));
        ProductRequest request = new ProductRequest("Aftosa", farm.getId(), null, null, BigDecimal.ONE, null);

        assertThatThrownBy(() -> service.createProduct(request))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        assertThatThrownBy(() -> service.updateProduct(vaccine.getId(), request))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        assertThatThrownBy(() -> service.deleteProduct(vaccine.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCategory()).isEqualTo(ProblemCategory.FORBIDDEN));
        assertThat(vaccine.getQuantity()).isEqualByComparingTo("40");
        verify(productRepository, never()).save(any());
        verify(productRepository, never()).delete(any());
    }

    @Test
    @DisplayName("a product cannot be moved to another farm")
    void farmIsImmutable() {
        actingAs(ownerA);
        when(productRepository.findById(vaccine.getId())).thenReturn(Optional.of(vaccine));

        assertThatThrownBy(() -> service.updateProduct(vaccine.getId(),
                new ProductRequest("Aftosa", UUID.randomUUID(), null, null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("IMMUTABLE_FIELD"));
    }
}
