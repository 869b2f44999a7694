package com.mymemo.repository;

import com.mymemo.entity.Reminder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

@Singleton
public class JpaReminderRepository implements ReminderRepository {
    private static final Logger log = LoggerFactory.getLogger(JpaReminderRepository.class);
    private final EntityManagerFactory emf;

    @Inject
    public JpaReminderRepository(EntityManagerFactory emf) {
        this.emf = emf;
    }

    private EntityManager getEntityManager() {
        return emf.createEntityManager();
    }

    @Override
    public long create(String userId, String content, int priority, String summary) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Reminder content must not be empty");
        }
        if (!Reminder.isValidPriority(priority)) {
            throw new IllegalArgumentException("Priority must be between "
                    + Reminder.MIN_PRIORITY + " and " + Reminder.MAX_PRIORITY + ": " + priority);
        }

        Reminder reminder = new Reminder(userId, content, priority, summary);
        inTransaction("create reminder", em -> {
            em.persist(reminder);
            em.flush();
            return null;
        });

        log.info("Reminder {} created for user {} with priority {}", reminder.getId(), userId, priority);
        return reminder.getId();
    }

    @Override
    public List<Reminder> listByUser(String userId) {
        EntityManager em = getEntityManager();
        try {
            return em.createNamedQuery("Reminder.findByUser", Reminder.class)
                    .setParameter("userId", userId)
                    .getResultList();
        } catch (Exception e) {
            log.error("Error listing reminders for user {}", userId, e);
            throw new RepositoryException("Failed to list reminders", e);
        } finally {
            em.close();
        }
    }

    @Override
    public int deleteByUserAndIds(String userId, Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        int deleted = inTransaction("delete reminders by id", em ->
                em.createNamedQuery("Reminder.deleteByUserAndIds")
                        .setParameter("userId", userId)
                        .setParameter("ids", ids)
                        .executeUpdate());
        log.info("Deleted {} reminder(s) by id for user {}", deleted, userId);
        return deleted;
    }

    @Override
    public int deleteByUserAndContentSubstring(String userId, String substring) {
        String pattern = "%" + escapeLike(substring.toLowerCase(Locale.ROOT)) + "%";
        int deleted = inTransaction("delete reminders by content", em ->
                em.createNamedQuery("Reminder.deleteByUserAndContent")
                        .setParameter("userId", userId)
                        .setParameter("pattern", pattern)
                        .executeUpdate());
        log.info("Deleted {} reminder(s) matching '{}' for user {}", deleted, substring, userId);
        return deleted;
    }

    @Override
    public int deleteAllByUser(String userId) {
        int deleted = inTransaction("clear reminders", em ->
                em.createNamedQuery("Reminder.deleteByUser")
                        .setParameter("userId", userId)
                        .executeUpdate());
        log.info("Cleared {} reminder(s) for user {}", deleted, userId);
        return deleted;
    }

    @Override
    public List<String> distinctUserIds() {
        EntityManager em = getEntityManager();
        try {
            return em.createNamedQuery("Reminder.findDistinctUsers", String.class)
                    .getResultList();
        } catch (Exception e) {
            log.error("Error fetching users with reminders", e);
            throw new RepositoryException("Failed to fetch users", e);
        } finally {
            em.close();
        }
    }

    private <T> T inTransaction(String operation, Function<EntityManager, T> work) {
        EntityManager em = getEntityManager();
        EntityTransaction tx = em.getTransaction();
        try {
            tx.begin();
            T result = work.apply(em);
            tx.commit();
            return result;
        } catch (Exception e) {
            log.error("Error in {}: {}", operation, e.getMessage(), e);
            if (tx.isActive()) {
                tx.rollback();
            }
            throw new RepositoryException("Failed to " + operation, e);
        } finally {
            em.close();
        }
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
