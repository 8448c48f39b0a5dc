package com.prediction.market.options_market.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.options_market.entity.MarketResolution;

@Repository
public interface MarketResolutionRepository extends MongoRepository<MarketResolution, String> {
}
