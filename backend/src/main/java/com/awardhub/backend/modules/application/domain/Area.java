package com.awardhub.backend.modules.application.domain;

public enum Area {
    ANDIJON("Andijon viloyati"),
    BUXORO("Buxoro viloyati"),
    FARGONA("Farg'ona viloyati"),
    JIZZAX("Jizzax viloyati"),
    NAMANGAN("Namangan viloyati"),
    NAVOIY("Navoiy viloyati"),
    QASHQADARYO("Qashqadaryo viloyati"),
    QORAQALPOGISTON("Qoraqalpog'iston Respublikasi"),
    SAMARQAND("Samarqand viloyati"),
    SIRDARYO("Sirdaryo viloyati"),
    SURXONDARYO("Surxondaryo viloyati"),
    TOSHKENT("Toshkent viloyati"),
    TOSHKENT_SHAHRI("Toshkent shahri"),
    XORAZM("Xorazm viloyati");

    private final String displayName;

    Area(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
