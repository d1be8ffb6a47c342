package com.takeaway.storefront.repository;

import com.takeaway.storefront.model.MenuItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {
    List<MenuItem> findAllByOrderByCategoryAscNameAsc();
    List<MenuItem> findByCategoryOrderByNameAsc(String category);
    List<MenuItem> findAllByOrderByIdDesc();

    @Query("SELECT DISTINCT m.category FROM MenuItem m WHERE m.category IS NOT NULL AND m.category <> '' ORDER BY m.category")
    List<String> findDistinctCategories();
}
