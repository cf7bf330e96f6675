package com.mifinca.backend.modules.farm.application;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.global.error.ProblemException;
import com.mifinca.backend.modules.access.application.AccessGuard;
import com.mifinca.backend.modules.access.domain.AccessOperation;
import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.access.domain.ResourcePolicy;
import com.mifinca.backend.modules.auth.application.CurrentActorService;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Product;
import com.mifinca.backend.modules.farm.infrastructure.persistence.FarmRepository;
import com.mifinca.backend.modules.farm.infrastructure.persistence.ProductRepository;
import com.mifinca.backend.modules.farm.presentation.dto.ProductRequest;
import com.mifinca.backend.modules.farm.presentation.dto.ProductResponse;
import com.mifinca.backend.modules.masterdata.application.MasterDataLookup;
import com.mifinca.backend.modules.masterdata.domain.MasterData;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProductService {

    private final ProductRepository productRepository;
    private final FarmRepository farmRepository;
    private final MasterDataLookup masterDataLookup;
    private final CurrentActorService currentActorService;
    private final AccessGuard accessGuard;

    public ProductService(
            ProductRepository productRepository,
            FarmRepository farmRepository,
            MasterDataLookup masterDataLookup,
            CurrentActorService currentActorService,
            AccessGuard accessGuard
    ) {
        this.productRepository = productRepository;
        this.farmRepository = farmRepository;
        this.masterDataLookup = masterDataLookup;
        this.currentActorService = currentActorService;
        this.accessGuard = accessGuard;
    }

    public ProductResponse createProduct(ProductRequest request) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(request.farmId());
        ProductReferences refs = resolveReferences(request);
        accessGuard.requireFarmScope(actor, farm, ResourcePolicy.PRODUCT, AccessOperation.WRITE);

        Product product = new Product();
        product.setFarm(farm);
        apply(product, request, refs);
        return ProductResponse.from(productRepository.save(product));
    }

    @Transactional(readOnly = true)
    public ProductResponse getProduct(UUID productId) {
        Actor actor = currentActorService.requireActor();
        Product product = loadProduct(productId);
        accessGuard.requireProduct(actor, product, AccessOperation.READ);
        return ProductResponse.from(product);
    }

    @Transactional(readOnly = true)
    public List<ProductResponse> listProducts(UUID farmId) {
        Actor actor = currentActorService.requireActor();
        Farm farm = loadFarm(farmId);
        accessGuard.requireFarmScope(actor, farm, ResourcePolicy.PRODUCT, AccessOperation.READ);
        return productRepository.findByFarm_IdOrderByNameAsc(farmId).stream()
                .map(ProductResponse::from)
                .toList();
    }

    public ProductResponse updateProduct(UUID productId, ProductRequest request) {
        Actor actor = currentActorService.requireActor();
        Product product = loadProduct(productId);
        if (!product.getFarm().getId().equals(request.farmId())) {
            throw ProblemException.invalid("IMMUTABLE_FIELD", "farmId cannot be changed");
        }
        ProductReferences refs = resolveReferences(request);
        accessGuard.requireProduct(actor, product, AccessOperation.WRITE);

        apply(product, request, refs);
        return ProductResponse.from(productRepository.save(product));
    }

    public void deleteProduct(UUID productId) {
        Actor actor = currentActorService.requireActor();
        Product product = loadProduct(productId);
        accessGuard.requireProduct(actor, product, AccessOperation.DELETE);
        productRepository.delete(product);
    }

    private ProductReferences resolveReferences(ProductRequest request) {
        return new ProductReferences(
                masterDataLookup.optionalCategory(request.productTypeId(), MasterDataCategory.PRODUCT_TYPE),
                masterDataLookup.optionalCategory(request.unitId(), MasterDataCategory.UNIT)
        );
    }

    private void apply(Product product, ProductRequest request, ProductReferences refs) {
        product.setName(request.name().trim());
        product.setProductType(refs.productType());
        product.setUnit(refs.unit());
        product.setQuantity(request.quantity());
        product.setDescription(request.description());
    }

    private record ProductReferences(MasterData productType, MasterData unit) {
    }

    private Product loadProduct(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> ProblemException.notFound("PRODUCT_NOT_FOUND"));
    }

    private Farm loadFarm(UUID farmId) {
        return farmRepository.findById(farmId)
                .orElseThrow(() -> ProblemException.notFound("FARM_NOT_FOUND"));
    }
}
