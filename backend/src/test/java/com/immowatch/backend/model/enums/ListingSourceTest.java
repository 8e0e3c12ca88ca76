package com.immowatch.backend.model.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ListingSourceTest {

    @Test
    void testFromAdUrl() {
        assertEquals(ListingSource.SELOGER, ListingSource.fromAdUrl("https://www.seloger.com/annonces/achat/123.htm"));
        assertEquals(ListingSource.LEBONCOIN, ListingSource.fromAdUrl("https://LEBONCOIN.fr/ventes_immobilieres/42.htm"));
        assertEquals(ListingSource.LEBONCOIN, ListingSource.fromAdUrl("leboncoin.fr/ventes_immobilieres/42.htm"));
        assertEquals(ListingSource.SELOGER, ListingSource.fromAdUrl("http://m.seloger.com/annonces/9.htm"));
        assertNull(ListingSource.fromAdUrl("https://www.pap.fr/annonce/1"));
        assertNull(ListingSource.fromAdUrl(null));
        assertNull(ListingSource.fromAdUrl("not a url"));
    }

    @Test
    void testSiteNameInPathOrLookalikeHostIsNotTheSite() {
        assertNull(ListingSource.fromAdUrl("https://www.pap.fr/compare/seloger.com/1"));
        assertNull(ListingSource.fromAdUrl("https://notseloger.com/annonces/1.htm"));
        assertNull(ListingSource.fromAdUrl("https://leboncoin.fr.example.org/annonces/1.htm"));
    }

    @Test
    void testFromSiteLabel() {
        assertEquals(ListingSource.SELOGER, ListingSource.fromSiteLabel("SeLoger"));
        assertEquals(ListingSource.SELOGER, ListingSource.fromSiteLabel("se_loger"));
        assertEquals(ListingSource.LEBONCOIN, ListingSource.fromSiteLabel("le-bon-coin"));
        assertEquals(ListingSource.LEBONCOIN, ListingSource.fromSiteLabel(" LBC "));
        assertNull(ListingSource.fromSiteLabel("pap"));
        assertNull(ListingSource.fromSiteLabel(null));
    }

    @Test
    void testAdUrlIsServedBySite() {
        String url = ListingSource.LEBONCOIN.adUrl("annonces/mock-42-1.htm");

        assertEquals("https://www.leboncoin.fr/annonces/mock-42-1.htm", url);
        assertEquals(ListingSource.LEBONCOIN, ListingSource.fromAdUrl(url));
        assertTrue(ListingSource.SELOGER.servesHost("WWW.SELOGER.COM"));
        assertFalse(ListingSource.SELOGER.servesHost("seloger.com.fr"));
    }

    @Test
    void testLabelsOfOtherEnums() {
        assertEquals(ListingKind.RENTAL, ListingKind.fromLabel(" Location "));
        assertEquals(ListingKind.SALE, ListingKind.fromLabel("sale"));
        assertNull(ListingKind.fromLabel("viager"));
        assertEquals(AdvertiserType.PRIVATE, AdvertiserType.fromLabel("Particulier"));
        assertEquals(AdvertiserType.AGENCY, AdvertiserType.fromLabel("agency"));
    }
}
