package com.prediction.market.options_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.options_market.entity.Trade;

@Repository
public interface TradeRepository extends MongoRepository<Trade, String> {

    /**
     * Replay order for rebuilding positions.
     */
    List<Trade> findByUserIdOrderByTimestampAsc(String userId);
}
