package com.billing.subscription.service;

import com.billing.common.error.ApiException;
import com.billing.subscription.dto.PlanResponse;
import com.billing.subscription.repository.PlanRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class PlanService {

    private final PlanRepository planRepository;

    public PlanService(PlanRepository planRepository) {
        this.planRepository = planRepository;
    }

    @Transactional(readOnly = true)
    public List<PlanResponse> listActive() {
        return planRepository.findByActiveTrueOrderByPriceAsc().stream().map(PlanResponse::from).toList();
    }

    @Transactional(readOnly = true)
    public PlanResponse get(UUID id) {
        return planRepository.findById(id)
                .map(PlanResponse::from)
                .orElseThrow(() -> ApiException.notFound(SubscriptionErrorCodes.PLAN_NOT_FOUND, "Plan not found",
                        Map.of("planId", id)));
    }
}
