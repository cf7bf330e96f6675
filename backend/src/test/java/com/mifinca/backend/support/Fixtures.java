package com.mifinca.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

import com.mifinca.backend.modules.access.domain.Actor;
import com.mifinca.backend.modules.animal.domain.Animal;
import com.mifinca.backend.modules.animal.domain.Grupo;
import com.mifinca.backend.modules.auth.domain.AppUser;
import com.mifinca.backend.modules.farm.domain.Farm;
import com.mifinca.backend.modules.farm.domain.Lot;

/**
 * Unsaved entities with fixed ids for Mockito-based tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static AppUser user(String email) {
        AppUser user = new AppUser();
        user.setEmail(email);
        user.setPasswordHash("hash");
        user.setFirstName(email.substring(0, email.indexOf('@')));
        user.setActive(true);
        return withId(user, UUID.randomUUID());
    }

    public static AppUser superuser(String email) {
        AppUser user = user(email);
        user.setSuperuser(true);
        return user;
    }

    public static Actor actor(AppUser user) {
        return new Actor(user.getId(), user.isActive(), user.isSuperuser());
    }

    public static Farm farm(String name, AppUser owner) {
        Farm farm = new Farm();
        farm.setName(name);
        farm.setOwner(owner);
        return withId(farm, UUID.randomUUID());
    }

    public static Lot lot(String name, Farm farm) {
        Lot lot = new Lot();
        lot.setName(name);
        lot.setFarm(farm);
        return withId(lot, UUID.randomUUID());
    }

    public static Animal animal(String tagId, AppUser owner, Lot lot) {
        Animal animal = new Animal();
        animal.setTagId(tagId);
        animal.setOwner(owner);
        animal.setCurrentLot(lot);
        return withId(animal, UUID.randomUUID());
    }

    public static Grupo grupo(String name, AppUser creator) {
        Grupo grupo = new Grupo();
        grupo.setName(name);
        grupo.setCreatedBy(creator);
        return withId(grupo, UUID.randomUUID());
    }

    public static <T> T withId(T entity, UUID id) {
        Class<?> type = entity.getClass();
        while (type != null) {
            try {
                Field idField = type.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(entity, id);
                return entity;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalStateException("No id field on " + entity.getClass());
    }
}
