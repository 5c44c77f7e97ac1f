package com.mikov.emailverifier.dtos;

/**
 * @param registrableDomain the registrable domain of the hostname, or null when the hostname
 *                          is itself a public suffix or sits under no known suffix
 */
public record RegistrabilityData(String registrableDomain) {
}
