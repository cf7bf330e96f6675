package com.mifinca.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.domain.Transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TransactionRepository extends JpaRepository<Transaction, UUID> {

    @Query("""
            select t from Transaction t
              left join t.toOwner receiver
             where t.fromOwner.id = :userId
                or receiver.id = :userId
             order by t.transactionDate desc
            """)
    List<Transaction> findInvolving(@Param("userId") UUID userId);
}
