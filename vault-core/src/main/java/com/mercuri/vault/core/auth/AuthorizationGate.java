package com.mercuri.vault.core.auth;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.ManagerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 호출자 권한 게이트.
 *
 * <p>호출자를 {@link Role#OWNER}, {@link Role#MANAGER}, {@link Role#DENIED} 중 하나로 분류합니다.</p>
 *
 * <p><strong>판정 규칙:</strong></p>
 * <ol>
 *   <li>caller == owner → OWNER</li>
 *   <li>caller == manager (영 주소 아님) 그리고 registry.isApproved(caller) → MANAGER</li>
 *   <li>그 외 → DENIED</li>
 * </ol>
 *
 * <p>Manager 필드와 레지스트리는 매 호출마다 새로 조회됩니다. 승인 취소는 다음 호출부터
 * 즉시 적용되며 유예 기간이 없습니다. Owner 판정은 레지스트리를 조회하지 않습니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class AuthorizationGate {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGate.class);

    private final Address owner;
    private final Supplier<Address> managerSupplier;
    private final ManagerRegistry registry;

    /**
     * 생성자.
     *
     * @param owner Vault owner (불변)
     * @param managerSupplier 현재 manager 조회 함수
     * @param registry manager 레지스트리
     * @throws IllegalArgumentException 인자가 null이거나 owner가 영 주소인 경우
     */
    public AuthorizationGate(Address owner, Supplier<Address> managerSupplier, ManagerRegistry registry) {
        if (owner == null || owner.isZero()) {
            throw new IllegalArgumentException("owner cannot be null or the zero address");
        }
        if (managerSupplier == null) {
            throw new IllegalArgumentException("managerSupplier cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.owner = owner;
        this.managerSupplier = managerSupplier;
        this.registry = registry;
    }

    /**
     * 호출자 분류.
     *
     * @param caller 호출자
     * @return 분류된 역할
     */
    public Role authorize(Address caller) {
        if (caller == null || caller.isZero()) {
            return Role.DENIED;
        }
        if (caller.equals(owner)) {
            return Role.OWNER;
        }
        Address manager = managerSupplier.get();
        if (manager != null && !manager.isZero() && caller.equals(manager) && registry.isApproved(caller)) {
            return Role.MANAGER;
        }
        return Role.DENIED;
    }

    /**
     * 작업 등급에 대한 권한 요구.
     *
     * @param caller 호출자
     * @param operationClass 작업 등급
     * @return 통과한 역할 (OWNER 또는 MANAGER)
     * @throws VaultException UNAUTHORIZED - 권한이 없는 경우
     */
    public Role require(Address caller, OperationClass operationClass) {
        Role role = authorize(caller);
        if (!role.permits(operationClass)) {
            log.warn("Rejected {} call from {} (role: {})", operationClass, caller, role);
            throw VaultException.unauthorized(
                String.format("caller %s is not authorized for %s operations", caller, operationClass)
            );
        }
        return role;
    }

    public Address owner() {
        return owner;
    }
}
