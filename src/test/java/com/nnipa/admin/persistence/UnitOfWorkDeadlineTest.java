package com.nnipa.admin.persistence;

import com.nnipa.admin.repository.AdminUserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "admin.unit-of-work.timeout-seconds=1")
class UnitOfWorkDeadlineTest {

    @Autowired
    private UnitOfWorkManager unitOfWorkManager;

    @Autowired
    private AdminUserRepository adminUserRepository;

    @Test
    @DisplayName("A unit of work past its deadline cannot commit and leaves nothing behind")
    void expiredUnitOfWorkRollsBack() throws Exception {
        String username = UnitOfWorkManagerTest.uniqueUsername();
        UnitOfWork handle;

        try (UnitOfWork unitOfWork = unitOfWorkManager.acquire()) {
            handle = unitOfWork;
            // insert is deferred to the flush at commit, after the deadline
            adminUserRepository.save(UnitOfWorkManagerTest.newUser(username));
            Thread.sleep(1500);

            assertThatThrownBy(unitOfWork::commit).isInstanceOf(RuntimeException.class);
        }

        assertThat(handle.getCompletion()).isEqualTo(UnitOfWorkState.ROLLED_BACK);
        assertThat(adminUserRepository.existsByUsername(username)).isFalse();
    }
}
