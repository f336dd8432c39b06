package com.caltrack.backend.product.service;

import com.caltrack.backend.common.tx.StoreWriteGate;
import com.caltrack.backend.dailylog.repo.FoodEntryRepository;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.product.repo.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Service
public class ProductService {

    private final ProductRepository productRepo;
    private final FoodEntryRepository entryRepo;
    private final StoreWriteGate gate;

    public ProductEntity create(ProductEntity draft) {
        if (draft.getName() == null || draft.getName().isBlank()) {
            throw new IllegalArgumentException("PRODUCT_NAME_REQUIRED");
        }
        return gate.write(() -> productRepo.save(draft));
    }

    @Transactional(readOnly = true)
    public ProductEntity get(String productId) {
        return productRepo.findById(productId)
                .orElseThrow(() -> new NoSuchElementException("PRODUCT_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public Optional<ProductEntity> findByBarcode(String barcode) {
        if (barcode == null || barcode.isBlank()) return Optional.empty();
        return productRepo.findFirstByBarcode(barcode.trim());
    }

    @Transactional(readOnly = true)
    public List<ProductEntity> listAll() {
        return productRepo.findAllByOrderByNameAsc();
    }

    /**
     * Deletes the product and detaches (not deletes) its entries.
     * Entries keep their name and nutrition snapshot.
     *
     * @return number of detached entries
     */
    public int delete(String productId) {
        return gate.write(() -> {
            ProductEntity p = productRepo.findById(productId)
                    .orElseThrow(() -> new NoSuchElementException("PRODUCT_NOT_FOUND"));

            int detached = entryRepo.clearProductReference(p.getId());
            productRepo.deleteById(p.getId());

            log.info("product deleted. id={} detachedEntries={}", p.getId(), detached);
            return detached;
        });
    }
}
