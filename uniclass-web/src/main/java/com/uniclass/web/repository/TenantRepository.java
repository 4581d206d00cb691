package com.uniclass.web.repository;

import com.uniclass.web.entity.TenantEntity;
import org.springframework.data.repository.CrudRepository;

public interface TenantRepository extends CrudRepository<TenantEntity, String> {
}
