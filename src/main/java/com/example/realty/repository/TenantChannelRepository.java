package com.example.realty.repository;

import com.example.realty.model.Channel;
import com.example.realty.model.TenantChannel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TenantChannelRepository extends JpaRepository<TenantChannel, Long> {

    Optional<TenantChannel> findByTenantIdAndChannel(Long tenantId, Channel channel);

    List<TenantChannel> findByTenantIdAndEnabledTrue(Long tenantId);
}
