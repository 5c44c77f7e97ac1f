package com.mikov.emailverifier.dtos;

/**
 * @param gravatarUrl URL of the custom avatar, null when the address has none
 */
public record GravatarData(String gravatarUrl) {
}
