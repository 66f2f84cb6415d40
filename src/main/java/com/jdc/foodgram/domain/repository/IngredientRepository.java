package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.entity.Ingredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IngredientRepository extends JpaRepository<Ingredient, Long> {

    boolean existsByNameAndMeasurementUnit(String name, String measurementUnit);
}
