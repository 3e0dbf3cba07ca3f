package com.churchadmin.service;

import com.churchadmin.config.PlanProperties;
import com.churchadmin.repository.ChurchRepository;
import com.churchadmin.repository.MemberRepository;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.UUID;

@Service
public class MemberLimitService {

    static final String DEFAULT_PLAN = "basic";

    private final ChurchRepository churchRepository;
    private final MemberRepository memberRepository;
    private final PlanProperties planProperties;

    public MemberLimitService(ChurchRepository churchRepository, MemberRepository memberRepository,
                              PlanProperties planProperties) {
        this.churchRepository = churchRepository;
        this.memberRepository = memberRepository;
        this.planProperties = planProperties;
    }

    /**
     * @throws MemberLimitExceededException when {@code toAdd} more members would exceed the church's plan
     */
    public void checkCanAdd(UUID churchId, int toAdd) {
        String plan = churchRepository.findSubscriptionPlan(churchId).orElse(DEFAULT_PLAN);
        int limit = planProperties.memberLimitFor(plan);
        if (limit == Integer.MAX_VALUE) {
            return;
        }

        int current = memberRepository.countByChurch(churchId);
        if ((long) current + toAdd <= limit) {
            return;
        }

        int remaining = Math.max(0, limit - current);
        String planName = StringUtils.capitalize(plan.toLowerCase(Locale.ROOT));
        throw new MemberLimitExceededException(
            "Cannot import " + toAdd + " members. Your " + planName + " plan allows up to " + limit
                + " members, and you currently have " + current + " members. You can add up to "
                + remaining + " more members. Upgrade to Premium for unlimited members.");
    }
}
