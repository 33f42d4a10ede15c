package com.vidnyan.rpax.domain.xaml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Well-known XAML namespaces used by workflow files.
 */
public final class XamlNamespaces {

    public static final String XAML = "http://schemas.microsoft.com/winfx/2006/xaml";
    public static final String ACTIVITIES = "http://schemas.microsoft.com/netfx/2009/xaml/activities";
    public static final String PRESENTATION = "http://schemas.microsoft.com/netfx/2009/xaml/activities/presentation";
    public static final String PRESENTATION_2010 = "http://schemas.microsoft.com/netfx/2010/xaml/activities/presentation";
    public static final String UIPATH_ACTIVITIES = "http://schemas.uipath.com/workflow/activities";
    public static final String XMLNS = "http://www.w3.org/2000/xmlns/";

    /** Prefix table merged into every document's namespace map. */
    public static final Map<String, String> STANDARD;

    static {
        Map<String, String> standard = new LinkedHashMap<>();
        standard.put("x", XAML);
        standard.put("activities", ACTIVITIES);
        standard.put("sap", PRESENTATION);
        standard.put("sap2010", PRESENTATION_2010);
        standard.put("ui", UIPATH_ACTIVITIES);
        standard.put("scg", "clr-namespace:System.Collections.Generic;assembly=mscorlib");
        standard.put("sco", "clr-namespace:System.Collections.ObjectModel;assembly=mscorlib");
        standard.put("snm", "clr-namespace:System.Net.Mail;assembly=System");
        standard.put("sd", "clr-namespace:System.Data;assembly=System.Data");
        standard.put("ss", "clr-namespace:System.Security;assembly=mscorlib");
        STANDARD = Collections.unmodifiableMap(standard);
    }

    private XamlNamespaces() {
    }
}
